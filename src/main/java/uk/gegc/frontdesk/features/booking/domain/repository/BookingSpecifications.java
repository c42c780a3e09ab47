package uk.gegc.frontdesk.features.booking.domain.repository;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import uk.gegc.frontdesk.features.booking.domain.model.Booking;
import uk.gegc.frontdesk.features.booking.domain.model.BookingSearchCriteria;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public final class BookingSpecifications {

    private BookingSpecifications() {
    }

    public static Specification<Booking> build(BookingSearchCriteria criteria) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (criteria == null) {
                return cb.and();
            }

            if (criteria.providerId() != null) {
                predicates.add(cb.equal(root.get("providerId"), criteria.providerId()));
            }

            if (criteria.status() != null) {
                predicates.add(cb.equal(root.get("status"), criteria.status()));
            }

            if (criteria.from() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<LocalDateTime>get("scheduledAt"), criteria.from()));
            }

            if (criteria.to() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<LocalDateTime>get("scheduledAt"), criteria.to()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
