package com.freshcart.storefront.domain.user;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * User 도메인 엔티티
 *
 * 인증/회원가입은 외부 인증 컴포넌트가 담당하며,
 * 스토어프론트는 X-USER-ID 헤더로 전달된 사용자의 존재 여부만 확인한다.
 */
@Entity
@Table(name = "users", uniqueConstraints = {
    @UniqueConstraint(columnNames = "username")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "username", nullable = false, length = 150)
    private String username;

    @Column(name = "email", length = 254)
    private String email;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static User create(String username, String email) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("사용자명은 필수입니다");
        }
        return User.builder()
                .username(username)
                .email(email)
                .createdAt(LocalDateTime.now())
                .build();
    }
}
