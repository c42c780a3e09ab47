package uk.gegc.frontdesk.features.booking.domain.rules;

import uk.gegc.frontdesk.features.booking.domain.model.BookingDraft;

import java.util.Optional;

/**
 * Extra booking check for one sector. Implementations are Spring beans picked up by
 * {@link SectorRuleRegistry}; a new sector gets a new bean, existing rules stay untouched.
 * Rules must not touch storage or any other state.
 */
public interface SectorRule {

    /**
     * Sector key this rule applies to, matched case-insensitively.
     */
    String sector();

    /**
     * @return the violation message, or empty when the draft satisfies the rule
     */
    Optional<String> evaluate(BookingDraft draft);
}
