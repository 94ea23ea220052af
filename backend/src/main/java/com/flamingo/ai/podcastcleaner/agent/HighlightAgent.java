package com.flamingo.ai.podcastcleaner.agent;

import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that extracts the top five takeaways of a cleaned transcript as a bullet list. */
public interface HighlightAgent {

  @UserMessage(
      """
        Read this transcript for "{{title}}" and extract the top 5 takeaways.

        Each takeaway should be:
        - One sentence, maximum 20 words
        - Crisp and clear with minimum jargon
        - A key insight, announcement, or important point from the video

        Return ONLY a bullet list with exactly 5 items. Do not include any intro text like
        "Here are the takeaways" - just the bullet points.

        TRANSCRIPT:
        {{transcript}}
        """)
  String extractTakeaways(@V("title") String title, @V("transcript") String transcript);
}
