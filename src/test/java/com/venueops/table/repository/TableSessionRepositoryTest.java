package com.venueops.table.repository;

import com.venueops.common.config.JpaConfig;
import com.venueops.table.entity.TableSession;
import com.venueops.table.entity.TableSessionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(JpaConfig.class)
class TableSessionRepositoryTest {

    @Autowired
    private TableSessionRepository tableSessionRepository;

    @Test
    @DisplayName("같은 테이블에 열린 세션은 하나뿐")
    void openKey_Unique() {
        tableSessionRepository.saveAndFlush(TableSession.openFor("venue-1", "T1", "order-1"));

        assertThatThrownBy(() -> tableSessionRepository.saveAndFlush(TableSession.openFor("venue-1", "T1", "order-2")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("닫힌 세션은 여러 개여도 새 세션을 열 수 있음")
    void closedSessions_DoNotBlockNewSession() {
        // Given
        tableSessionRepository.saveAndFlush(TableSession.openFor("venue-1", "T2", "order-1"));
        tableSessionRepository.closeForOrder("venue-1", "order-1", TableSessionStatus.FREE, LocalDateTime.now());
        tableSessionRepository.saveAndFlush(TableSession.openFor("venue-1", "T2", "order-2"));
        tableSessionRepository.closeByOpenKey("venue-1:T2", TableSessionStatus.FREE, LocalDateTime.now());

        // When
        TableSession third = tableSessionRepository.saveAndFlush(TableSession.openFor("venue-1", "T2", "order-3"));

        // Then
        assertThat(tableSessionRepository.findByOpenKey("venue-1:T2"))
                .get()
                .extracting(TableSession::getId)
                .isEqualTo(third.getId());
        assertThat(tableSessionRepository.findByVenueIdAndBoundOrderIdAndClosedAtIsNull("venue-1", "order-1")).isEmpty();
    }

    @Test
    @DisplayName("미바인딩 세션에만 주문 바인딩")
    void bindOrder_OnlyWhenUnbound() {
        // Given
        TableSession reserved = tableSessionRepository.saveAndFlush(TableSession.reserve("venue-1", "T3"));

        // When
        int first = tableSessionRepository.bindOrder(reserved.getId(), "order-1", TableSessionStatus.OCCUPIED);
        int second = tableSessionRepository.bindOrder(reserved.getId(), "order-2", TableSessionStatus.OCCUPIED);

        // Then
        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        TableSession bound = tableSessionRepository.findById(reserved.getId()).orElseThrow();
        assertThat(bound.getBoundOrderId()).isEqualTo("order-1");
        assertThat(bound.getStatus()).isEqualTo(TableSessionStatus.OCCUPIED);
    }
}
