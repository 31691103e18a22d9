package com.venueops.table.controller;

import com.venueops.common.dto.ApiResponse;
import com.venueops.table.dto.TableSessionResponse;
import com.venueops.table.service.TableSessionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/venues/{venueId}/tables/{tableRef}/session")
@RequiredArgsConstructor
public class TableSessionController {

    private final TableSessionManager tableSessionManager;

    @GetMapping
    public ApiResponse<TableSessionResponse> getSession(@PathVariable String venueId,
                                                        @PathVariable String tableRef) {
        return ApiResponse.ok(tableSessionManager.findOpenSession(venueId, tableRef)
                .map(TableSessionResponse::from)
                .orElseGet(() -> TableSessionResponse.free(venueId, tableRef)));
    }

    @PostMapping("/reserve")
    public ApiResponse<TableSessionResponse> reserve(@PathVariable String venueId,
                                                     @PathVariable String tableRef) {
        return ApiResponse.ok(TableSessionResponse.from(tableSessionManager.reserve(venueId, tableRef)));
    }

    /** 스태프 수동 테이블 정리 */
    @DeleteMapping
    public ApiResponse<Boolean> free(@PathVariable String venueId,
                                     @PathVariable String tableRef) {
        return ApiResponse.ok(tableSessionManager.free(venueId, tableRef));
    }
}
