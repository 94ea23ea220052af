package com.flamingo.ai.podcastcleaner.agent;

import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that cleans a raw auto-caption transcript into readable markdown.
 *
 * <p>Output contract: speaker turns separated by line breaks, paragraphs of at most 200 words,
 * chapters introduced by {@code ###} subheaders, substance kept as close to the original as
 * possible.
 */
public interface TranscriptCleaningAgent {

  @UserMessage(
      """
        Clean up this podcast transcript for "{{title}}".

        Combine paragraphs from the same speaker, fix capitalization and punctuation, remove
        filler words like unnecessary "like"s "you know"s and "um"s, and remove repeated words.
        If there are names, use context clues to figure out who it is. Make sure all sentences
        are grammatical, but do not add new phrases/clauses/ideas of your own.

        Split the transcript into natural paragraphs, where each paragraph is maximum 200 words.
        For podcasts with multiple speakers, there should always be a line break between each
        speaker's section and the next (even if this results in short paragraphs).

        After cleaning the transcript, add chapters to split up sections/themes. Give each
        chapter a bolded title and insert them into the transcript as subheaders (use ###
        markdown formatting). The title should be a single short sentence expressing the key
        takeaway of that chapter. Every chapter should contain at least two paragraphs.

        Otherwise, modify the original substance the minimum amount. Make sure the transcript
        is complete and not missing chunks. Be very meticulous.

        Return ONLY the cleaned transcript. Do not include any intro text like "Here's the
        cleaned transcript..." - just start directly with the first chapter heading and content.

        TRANSCRIPT:
        {{transcript}}
        """)
  String clean(@V("title") String title, @V("transcript") String transcript);
}
