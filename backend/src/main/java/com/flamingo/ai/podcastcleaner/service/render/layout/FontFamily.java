package com.flamingo.ai.podcastcleaner.service.render.layout;

import java.util.Locale;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts.FontName;

/**
 * Fonts a PDF may be requested in. Each maps to a Standard 14 family so that no font file has to
 * be embedded.
 */
public enum FontFamily {
  ARIAL("Arial", FontName.HELVETICA, FontName.HELVETICA_BOLD),
  CALIBRI("Calibri", FontName.HELVETICA, FontName.HELVETICA_BOLD),
  COMIC_SANS_MS("Comic Sans MS", FontName.HELVETICA, FontName.HELVETICA_BOLD),
  GARAMOND("Garamond", FontName.TIMES_ROMAN, FontName.TIMES_BOLD),
  GEORGIA("Georgia", FontName.TIMES_ROMAN, FontName.TIMES_BOLD),
  TAHOMA("Tahoma", FontName.HELVETICA, FontName.HELVETICA_BOLD),
  TIMES_NEW_ROMAN("Times New Roman", FontName.TIMES_ROMAN, FontName.TIMES_BOLD),
  // Symbol glyphs would make the document unreadable; render it in a plain sans face
  WINGDINGS("Wingdings", FontName.HELVETICA, FontName.HELVETICA_BOLD);

  public static final FontFamily DEFAULT = TIMES_NEW_ROMAN;

  private final String displayName;
  private final FontName regular;
  private final FontName bold;

  FontFamily(String displayName, FontName regular, FontName bold) {
    this.displayName = displayName;
    this.regular = regular;
    this.bold = bold;
  }

  public String getDisplayName() {
    return displayName;
  }

  public FontName getRegular() {
    return regular;
  }

  public FontName getBold() {
    return bold;
  }

  /** Looks up a family by display name, ignoring case; unknown or blank names give the default. */
  public static FontFamily fromName(String name) {
    if (name == null || name.isBlank()) {
      return DEFAULT;
    }
    String wanted = name.strip().toLowerCase(Locale.ROOT);
    for (FontFamily family : values()) {
      if (family.displayName.toLowerCase(Locale.ROOT).equals(wanted)) {
        return family;
      }
    }
    return DEFAULT;
  }
}
