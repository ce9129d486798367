package com.storemock.commerce.application.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.storemock.commerce.common.exception.ErrorCode;
import com.storemock.commerce.common.exception.SystemException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * RequestFingerprint - 요청 본문 해시 (SHA-256, hex)
 *
 * 키 순서를 정렬한 JSON으로 직렬화하므로 필드 순서가 달라도 같은 해시가 나옵니다.
 */
@Component
public class RequestFingerprint {

    private final ObjectMapper canonicalMapper;

    public RequestFingerprint(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String hash(Object payload) {
        try {
            // POJO도 Map으로 바꿔서 키 정렬 대상이 되도록 함
            Object tree = canonicalMapper.convertValue(payload, Object.class);
            byte[] canonical = canonicalMapper.writeValueAsString(tree).getBytes(StandardCharsets.UTF_8);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SystemException(ErrorCode.SERIALIZATION_FAILED, e);
        } catch (NoSuchAlgorithmException e) {
            throw new SystemException(ErrorCode.INTERNAL_ERROR, e);
        }
    }
}
