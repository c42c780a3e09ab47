package uk.gegc.frontdesk.features.booking.domain.rules;

import java.util.Locale;

final class NotesKeywords {

    private NotesKeywords() {
    }

    static boolean mentions(String notes, String keyword) {
        if (notes == null) {
            return false;
        }
        return notes.toLowerCase(Locale.ROOT).contains(keyword.toLowerCase(Locale.ROOT));
    }
}
