package quest.gekko.kolmetrics.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(name = "campaign")
@Getter @Setter
public class Campaign {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "agency_id", nullable = false)
    Organization agency;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "client_id")
    Organization client;

    @Column(nullable = false)
    String name;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "campaign_keyword", joinColumns = @JoinColumn(name = "campaign_id"))
    @Column(name = "keyword")
    List<String> keywords = new ArrayList<>();

    @ManyToMany
    @JoinTable(name = "campaign_kol",
            joinColumns = @JoinColumn(name = "campaign_id"),
            inverseJoinColumns = @JoinColumn(name = "kol_id"))
    Set<Kol> kols = new LinkedHashSet<>();

    String projectTwitterHandle;
    String projectAvatarUrl;
    String projectBannerUrl;

    Instant createdAt = Instant.now();
}
