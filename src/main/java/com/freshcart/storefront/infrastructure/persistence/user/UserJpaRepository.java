package com.freshcart.storefront.infrastructure.persistence.user;

import com.freshcart.storefront.domain.user.User;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * User JPA Repository
 */
public interface UserJpaRepository extends JpaRepository<User, Long> {
}
