package com.freshcart.storefront.infrastructure.persistence.cart;

import com.freshcart.storefront.domain.cart.Cart;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Cart JPA Repository
 */
public interface CartJpaRepository extends JpaRepository<Cart, Long> {
    Optional<Cart> findByUserId(Long userId);
}
