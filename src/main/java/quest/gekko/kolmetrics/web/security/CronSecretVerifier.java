package quest.gekko.kolmetrics.web.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;
import quest.gekko.kolmetrics.config.KolProperties;
import quest.gekko.kolmetrics.web.exception.CronSecretMisconfiguredException;
import quest.gekko.kolmetrics.web.exception.TenantAccessException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the {@code Authorization: Bearer <secret>} header of the scheduled trigger. Without a
 * configured secret the trigger is refused under the {@code prod} profile and allowed elsewhere.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CronSecretVerifier {
    private final KolProperties.Cron cron;
    private final Environment environment;

    public void verify(final String authorizationHeader) {
        final String secret = cron.secret();
        if (secret == null || secret.isBlank()) {
            if (environment.acceptsProfiles(Profiles.of("prod"))) {
                throw new CronSecretMisconfiguredException();
            }
            log.warn("kol.cron.secret is not set, accepting unauthenticated refresh trigger");
            return;
        }
        final byte[] expected = ("Bearer " + secret).getBytes(StandardCharsets.UTF_8);
        final byte[] actual = authorizationHeader == null ? new byte[0] : authorizationHeader.getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, actual)) {
            throw TenantAccessException.unauthenticated();
        }
    }
}
