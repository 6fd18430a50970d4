package com.incoresoft.timeAttendance.domain.sync.service;

import com.incoresoft.timeAttendance.config.DeviceProps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks the X-Sync-Signature header of agent pushes: hex HMAC-SHA256 of the raw body
 * under the shared agent secret.
 */
@Component
@RequiredArgsConstructor
public class SyncSignatureVerifier {
    private static final String ALGORITHM = "HmacSHA256";

    private final DeviceProps props;

    public boolean isValid(byte[] body, String signature) {
        String secret = props.getAgentSecret();
        if (secret == null || secret.isBlank() || signature == null || signature.isBlank()) {
            return false;
        }
        byte[] given;
        try {
            given = HexFormat.of().parseHex(signature.trim().toLowerCase());
        } catch (IllegalArgumentException ex) {
            return false;
        }
        return MessageDigest.isEqual(sign(secret, body), given);
    }

    public static String signHex(String secret, byte[] body) {
        return HexFormat.of().formatHex(sign(secret, body));
    }

    private static byte[] sign(String secret, byte[] body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(body);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", ex);
        }
    }
}
