package com.relaycast.services.messaging.org.model;

import java.time.LocalDateTime;
import java.util.List;

import com.relaycast.services.messaging.common.converter.StringListConverter;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "orgs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Org {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    /**
     * ISO-639-3 code of the org's primary language, may be null
     */
    @Column(name = "primary_language", length = 3)
    private String primaryLanguage;

    /**
     * All languages the org has configured, including the primary one
     */
    @Convert(converter = StringListConverter.class)
    @Column(name = "languages", columnDefinition = "TEXT")
    private List<String> languages;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, insertable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean supportsLanguage(String language) {
        return language != null && languages != null && languages.contains(language);
    }
}
