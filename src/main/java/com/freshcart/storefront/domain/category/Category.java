package com.freshcart.storefront.domain.category;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Category 도메인 엔티티
 * 상품 분류 (이름순 정렬, 비활성 카테고리는 스토어프론트에 노출되지 않음)
 */
@Entity
@Table(name = "categories", uniqueConstraints = {
    @UniqueConstraint(columnNames = "name"),
    @UniqueConstraint(columnNames = "slug")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Category {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "category_id")
    private Long categoryId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "slug", nullable = false, length = 120)
    private String slug;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static Category create(String name, String slug, String description) {
        return Category.builder()
                .name(name)
                .slug(slug)
                .description(description)
                .active(true)
                .createdAt(LocalDateTime.now())
                .build();
    }
}
