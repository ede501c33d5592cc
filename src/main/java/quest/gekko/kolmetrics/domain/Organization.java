package quest.gekko.kolmetrics.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * A tenant. Provider credential columns hold encrypted values and are only ever
 * decrypted into a {@code CredentialContext}.
 */
@Entity
@Table(name = "organization")
@Getter @Setter
public class Organization {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(nullable = false)
    String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    OrganizationType type;

    @Column(columnDefinition = "text")
    String socialDataApiKey;

    @Column(columnDefinition = "text")
    String apifyApiKey;

    @Column(columnDefinition = "text")
    String twitterApiKey;

    @Column(columnDefinition = "text")
    String twitterCookies;

    @Column(columnDefinition = "text")
    String twitterCsrfToken;

    Instant createdAt = Instant.now();
}
