package com.venueops.order.service;

import com.venueops.order.entity.FulfillmentType;
import com.venueops.order.entity.OrderSource;
import com.venueops.order.entity.PaymentMethod;
import com.venueops.order.entity.QrType;
import com.venueops.venue.service.VenuePolicy;
import org.springframework.stereotype.Component;

/**
 * 결제 방식 호환성 검사 - (주문 유형, QR 종류, 결제 방식, 주문 경로, 매장 설정) 조합 허용 여부.
 *
 * <p>상태를 갖지 않는 순수 함수. 클라이언트 화면에서 선택지를 숨기더라도
 * 서버는 주문 생성 시 항상 이 검사를 다시 수행한다.</p>
 *
 * <h3>규칙 (위에서부터 순서대로)</h3>
 * <ol>
 *   <li>QR 종류와 주문 유형이 일치해야 함 (TABLE_* ↔ TABLE, COUNTER_* ↔ COUNTER)</li>
 *   <li>MANUAL 결제는 STAFF 경로 주문만</li>
 *   <li>TABLE_COLLECTION + PAY_AT_TILL은 매장 설정으로 허용된 경우만</li>
 *   <li>COUNTER + PAY_LATER는 매장 설정으로 허용된 경우만</li>
 *   <li>TABLE_COLLECTION + PAY_LATER 불가 (수령 전에 정산되어야 함)</li>
 * </ol>
 */
@Component
public class PaymentCompatibilityValidator {

    public CompatibilityResult validate(FulfillmentType fulfillmentType, QrType qrType,
                                        PaymentMethod paymentMethod, OrderSource source,
                                        VenuePolicy policy) {
        if (!qrType.supports(fulfillmentType)) {
            return CompatibilityResult.deny(
                    "QR type " + qrType + " cannot be used for " + fulfillmentType + " orders");
        }
        if (paymentMethod == PaymentMethod.MANUAL && source != OrderSource.STAFF) {
            return CompatibilityResult.deny("MANUAL payment is only available to staff-entered orders");
        }
        if (qrType == QrType.TABLE_COLLECTION && paymentMethod == PaymentMethod.PAY_AT_TILL
                && !policy.allowPayAtTillForTableCollection()) {
            return CompatibilityResult.deny("Pay at till is not enabled for table collection orders at this venue");
        }
        if (fulfillmentType == FulfillmentType.COUNTER && paymentMethod == PaymentMethod.PAY_LATER
                && !policy.allowCounterPayLater()) {
            return CompatibilityResult.deny("Pay later is not enabled for counter orders at this venue");
        }
        if (qrType == QrType.TABLE_COLLECTION && paymentMethod == PaymentMethod.PAY_LATER) {
            return CompatibilityResult.deny("Table collection orders must be paid before pickup");
        }
        return CompatibilityResult.allow();
    }
}
