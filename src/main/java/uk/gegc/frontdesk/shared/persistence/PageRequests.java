package uk.gegc.frontdesk.shared.persistence;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

public final class PageRequests {

    static final int UNPAGED_LIMIT = 100;

    private PageRequests() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns a page request whose ordering is total: the caller's sort (or {@code defaultSort}
     * when none was given) followed by {@code id}, so rows with equal sort keys keep insertion order.
     */
    public static Pageable withStableOrder(Pageable pageable, Sort defaultSort) {
        Sort sort = pageable.getSort().isSorted() ? pageable.getSort() : defaultSort;
        if (sort.getOrderFor("id") == null) {
            sort = sort.and(Sort.by(Sort.Direction.ASC, "id"));
        }
        if (pageable.isUnpaged()) {
            return PageRequest.of(0, UNPAGED_LIMIT, sort);
        }
        return PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), sort);
    }
}
