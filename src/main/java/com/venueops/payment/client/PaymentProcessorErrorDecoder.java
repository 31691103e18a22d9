package com.venueops.payment.client;

import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import feign.Response;
import feign.Util;
import feign.codec.ErrorDecoder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * 결제 대행사 오류 응답 분류.
 *
 * <ul>
 *   <li>5xx, 429 → {@link TransientProcessorException} (재시도)</li>
 *   <li>4xx + {@code charge_already_refunded} → {@link RefundAlreadyProcessedException}</li>
 *   <li>그 밖의 4xx → PROCESSOR_REJECTED (재시도 안 함)</li>
 * </ul>
 */
@Slf4j
public class PaymentProcessorErrorDecoder implements ErrorDecoder {

    static final String ALREADY_REFUNDED_CODE = "charge_already_refunded";

    @Override
    public Exception decode(String methodKey, Response response) {
        int status = response.status();
        String body = readBody(response);

        if (status >= 500 || status == 429) {
            return new TransientProcessorException(
                    "Payment processor unavailable: " + methodKey + " status=" + status);
        }
        if (body.contains(ALREADY_REFUNDED_CODE)) {
            return new RefundAlreadyProcessedException("Charge already refunded at processor: " + methodKey);
        }
        log.warn("Payment processor rejected request: method={}, status={}, body={}", methodKey, status, body);
        return new BusinessException(ErrorCode.PROCESSOR_REJECTED,
                "Payment processor rejected the request (status " + status + ")");
    }

    private String readBody(Response response) {
        if (response.body() == null) {
            return "";
        }
        try (Reader reader = response.body().asReader(StandardCharsets.UTF_8)) {
            return Util.toString(reader);
        } catch (IOException e) {
            log.debug("Could not read processor error body: {}", e.getMessage());
            return "";
        }
    }
}
