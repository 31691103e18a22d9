package com.venueops.table.service;

import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.table.entity.DiningTable;
import com.venueops.table.entity.TableSession;
import com.venueops.table.entity.TableSessionStatus;
import com.venueops.table.repository.DiningTableRepository;
import com.venueops.table.repository.TableSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 테이블 세션 관리자 - 테이블 점유와 주문 바인딩의 유일한 작성자.
 *
 * <h3>트랜잭션 경계</h3>
 * <p>OrderService의 트랜잭션 안에서 호출된다. 주문 생성과 세션 오픈,
 * 주문 종료와 세션 해제가 같은 커밋으로 묶이므로 "완료된 주문이 테이블을 계속 점유"하는
 * 중간 상태는 외부에 보이지 않는다.</p>
 *
 * <h3>동시성</h3>
 * <ul>
 *   <li>세션 생성 경합: openKey UNIQUE 제약 위반 → TABLE_OCCUPIED</li>
 *   <li>미바인딩 세션 바인딩 경합: 조건부 UPDATE (boundOrderId IS NULL) 0행 → TABLE_OCCUPIED</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TableSessionManager {

    private final TableSessionRepository tableSessionRepository;
    private final DiningTableRepository diningTableRepository;

    /**
     * 테이블 세션을 열거나 기존 열린 세션에 주문을 바인딩한다.
     * 이미 같은 주문이 바인딩되어 있으면 그대로 반환한다.
     */
    @Transactional
    public TableSession openOrAttach(String venueId, String tableRef, String orderId) {
        provisionTable(venueId, tableRef);

        Optional<TableSession> open = tableSessionRepository.findByOpenKey(TableSession.openKeyOf(venueId, tableRef));
        if (open.isEmpty()) {
            return openNew(TableSession.openFor(venueId, tableRef, orderId));
        }

        TableSession session = open.get();
        if (session.isBoundTo(orderId)) {
            return session;
        }
        if (session.getBoundOrderId() != null) {
            throw occupied(venueId, tableRef);
        }

        int updated = tableSessionRepository.bindOrder(session.getId(), orderId, TableSessionStatus.OCCUPIED);
        if (updated == 0) {
            throw occupied(venueId, tableRef);
        }
        log.info("Order bound to open table session: venueId={}, table={}, sessionId={}, orderId={}",
                venueId, tableRef, session.getId(), orderId);
        return tableSessionRepository.findById(session.getId())
                .orElseThrow(() -> new BusinessException(ErrorCode.INTERNAL_ERROR, "Table session vanished after bind"));
    }

    /** 주문 없이 테이블을 연다 (예약 손님 착석 등). 이미 열려 있으면 기존 세션 반환. */
    @Transactional
    public TableSession reserve(String venueId, String tableRef) {
        provisionTable(venueId, tableRef);
        return tableSessionRepository.findByOpenKey(TableSession.openKeyOf(venueId, tableRef))
                .orElseGet(() -> openNew(TableSession.reserve(venueId, tableRef)));
    }

    /** 테이블의 열린 세션을 닫는다. 열린 세션이 없으면 아무 일도 하지 않는다. */
    @Transactional
    public boolean free(String venueId, String tableRef) {
        int closed = tableSessionRepository.closeByOpenKey(
                TableSession.openKeyOf(venueId, tableRef), TableSessionStatus.FREE, LocalDateTime.now());
        if (closed > 0) {
            log.info("Table session freed: venueId={}, table={}", venueId, tableRef);
        }
        return closed > 0;
    }

    /** 주문에 바인딩된 열린 세션을 닫는다. 카운터 주문처럼 세션이 없으면 no-op. */
    @Transactional
    public boolean freeForOrder(String venueId, String orderId) {
        int closed = tableSessionRepository.closeForOrder(venueId, orderId, TableSessionStatus.FREE, LocalDateTime.now());
        if (closed > 0) {
            log.info("Table session freed for order: venueId={}, orderId={}", venueId, orderId);
        }
        return closed > 0;
    }

    public Optional<TableSession> findOpenSession(String venueId, String tableRef) {
        return tableSessionRepository.findByOpenKey(TableSession.openKeyOf(venueId, tableRef));
    }

    private TableSession openNew(TableSession session) {
        try {
            TableSession saved = tableSessionRepository.saveAndFlush(session);
            log.info("Table session opened: venueId={}, table={}, sessionId={}, orderId={}",
                    saved.getVenueId(), saved.getTableRef(), saved.getId(), saved.getBoundOrderId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // 다른 요청이 같은 테이블 세션을 먼저 열었음
            throw new BusinessException(ErrorCode.TABLE_OCCUPIED,
                    "Table " + session.getTableRef() + " was opened concurrently by another order", e);
        }
    }

    private void provisionTable(String venueId, String tableRef) {
        if (diningTableRepository.findByVenueIdAndLabel(venueId, tableRef).isEmpty()) {
            diningTableRepository.save(DiningTable.builder()
                    .venueId(venueId)
                    .label(tableRef)
                    .build());
            log.info("Dining table auto-provisioned: venueId={}, label={}, seats={}",
                    venueId, tableRef, DiningTable.DEFAULT_SEAT_COUNT);
        }
    }

    private BusinessException occupied(String venueId, String tableRef) {
        return new BusinessException(ErrorCode.TABLE_OCCUPIED,
                "Table " + tableRef + " at venue " + venueId + " is bound to another order");
    }
}
