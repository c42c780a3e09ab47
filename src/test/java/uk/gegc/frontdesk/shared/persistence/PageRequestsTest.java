package uk.gegc.frontdesk.shared.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import static org.assertj.core.api.Assertions.assertThat;

class PageRequestsTest {

    private static final Sort BY_SCHEDULE = Sort.by(Sort.Direction.ASC, "scheduledAt");

    @Test
    @DisplayName("unsorted request falls back to the default sort with id as tiebreak")
    void unsortedUsesDefault() {
        Pageable result = PageRequests.withStableOrder(PageRequest.of(2, 10), BY_SCHEDULE);

        assertThat(result.getPageNumber()).isEqualTo(2);
        assertThat(result.getPageSize()).isEqualTo(10);
        assertThat(result.getSort().toList())
                .extracting(Sort.Order::getProperty)
                .containsExactly("scheduledAt", "id");
    }

    @Test
    @DisplayName("caller sort is kept and id appended once")
    void callerSortKept() {
        Pageable request = PageRequest.of(0, 5, Sort.by(Sort.Direction.DESC, "clientName"));

        Pageable result = PageRequests.withStableOrder(request, BY_SCHEDULE);

        assertThat(result.getSort().getOrderFor("clientName").getDirection()).isEqualTo(Sort.Direction.DESC);
        assertThat(result.getSort().getOrderFor("id")).isNotNull();
        assertThat(result.getSort().getOrderFor("scheduledAt")).isNull();
    }

    @Test
    @DisplayName("explicit id sort is not duplicated")
    void explicitIdNotDuplicated() {
        Pageable request = PageRequest.of(0, 5, Sort.by(Sort.Direction.DESC, "id"));

        Pageable result = PageRequests.withStableOrder(request, BY_SCHEDULE);

        assertThat(result.getSort().toList()).hasSize(1);
        assertThat(result.getSort().getOrderFor("id").getDirection()).isEqualTo(Sort.Direction.DESC);
    }

    @Test
    @DisplayName("unpaged request is capped at one page of 100")
    void unpagedIsCapped() {
        Pageable result = PageRequests.withStableOrder(Pageable.unpaged(), BY_SCHEDULE);

        assertThat(result.getPageNumber()).isZero();
        assertThat(result.getPageSize()).isEqualTo(100);
    }
}
