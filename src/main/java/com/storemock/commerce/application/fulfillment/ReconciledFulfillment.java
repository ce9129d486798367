package com.storemock.commerce.application.fulfillment;

import com.storemock.commerce.domain.fulfillment.FulfillmentDestination;
import com.storemock.commerce.domain.fulfillment.FulfillmentState;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 배송 업데이트 병합 결과
 *
 * newAddresses: 새로 ID가 발급된 배송지 (체크아웃 저장 성공 후 고객 주소록에 기록)
 */
@Getter
@AllArgsConstructor
public class ReconciledFulfillment {

    private final FulfillmentState state;
    private final List<FulfillmentDestination> newAddresses;
}
