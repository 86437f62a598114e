package com.hinata.backend.modules.auth.application.token;

import java.time.Clock;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * {@code hinata.auth.mode} 값으로 토큰 서명 방식을 기동 시 한 번 고른다.
 */
@Configuration
public class TokenSignerConfig {

    private static final Logger log = LoggerFactory.getLogger(TokenSignerConfig.class);

    @Bean
    public TokenSigner tokenSigner(
            @Value("${hinata.auth.mode:hmac}") String mode,
            @Value("${hinata.auth.secret:}") String secret,
            @Value("${hinata.auth.algorithm:HS256}") String algorithm,
            @Value("${hinata.auth.private-key:}") String privateKeyPem,
            @Value("${hinata.auth.public-key:}") String publicKeyPem,
            Clock clock
    ) {
        String normalized = mode.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "hmac":
                log.info("Token signing: HMAC ({})", algorithm);
                return new HmacTokenSigner(secret, algorithm, clock);
            case "eddsa":
                log.info("Token signing: EdDSA (Ed25519)");
                return new EdDsaTokenSigner(PemKeys.readPrivateKey(privateKeyPem), PemKeys.readPublicKey(publicKeyPem), clock);
            default:
                throw new IllegalStateException("Unknown hinata.auth.mode '" + mode + "', expected hmac or eddsa");
        }
    }
}
