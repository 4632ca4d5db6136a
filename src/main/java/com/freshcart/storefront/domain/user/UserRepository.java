package com.freshcart.storefront.domain.user;

import java.util.Optional;

/**
 * User Repository Interface (Domain Layer - Port)
 */
public interface UserRepository {

    Optional<User> findById(Long userId);

    /**
     * 사용자 존재 여부 확인
     *
     * @param userId 사용자 ID
     * @return 존재 여부
     */
    boolean existsById(Long userId);

    User save(User user);
}
