package com.venueops.table.dto;

import com.venueops.table.entity.TableSession;
import com.venueops.table.entity.TableSessionStatus;

import java.time.LocalDateTime;

public record TableSessionResponse(
        String sessionId,
        String venueId,
        String tableRef,
        TableSessionStatus status,
        String boundOrderId,
        LocalDateTime openedAt
) {
    public static TableSessionResponse from(TableSession session) {
        return new TableSessionResponse(
                session.getId(),
                session.getVenueId(),
                session.getTableRef(),
                session.getStatus(),
                session.getBoundOrderId(),
                session.getOpenedAt());
    }

    /** 열린 세션이 없는 테이블 */
    public static TableSessionResponse free(String venueId, String tableRef) {
        return new TableSessionResponse(null, venueId, tableRef, TableSessionStatus.FREE, null, null);
    }
}
