package com.storemock.commerce.common.protocol;

/**
 * UCP 프로토콜 상수 (버전, capability 이름)
 */
public final class UcpProtocol {

    public static final String VERSION = "2026-01-11";
    public static final String CHECKOUT_CAPABILITY = "dev.ucp.shopping.checkout";
    public static final String ORDER_CAPABILITY = "dev.ucp.shopping.order";

    /**
     * 에이전트 프로필 URL을 담는 요청 헤더 (예: profile="https://agent.example/profile.json")
     */
    public static final String AGENT_HEADER = "UCP-Agent";
    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    public static final String SIMULATION_SECRET_HEADER = "Simulation-Secret";

    private UcpProtocol() {
    }
}
