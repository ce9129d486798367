package com.storemock.commerce.application.common.dto;

import com.storemock.commerce.common.protocol.UcpProtocol;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 응답의 ucp 블록 {version, capabilities[{name, version}]}
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class UcpMetadata {

    private String version;
    private List<Capability> capabilities;

    public static UcpMetadata of(String capabilityName) {
        return new UcpMetadata(UcpProtocol.VERSION,
                List.of(new Capability(capabilityName, UcpProtocol.VERSION)));
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Capability {
        private String name;
        private String version;
    }
}
