package com.webchat.chatbackend.user;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByUsername(String username);

    boolean existsByUsernameIgnoreCase(String username);

    boolean existsByEmailIgnoreCase(String email);

    // Suggestions for an empty search box
    List<User> findByIdNot(Long excludedId, Pageable pageable);

    @Query("""
        SELECT u FROM User u
        WHERE u.id <> :excludedId
          AND (lower(u.username) LIKE lower(concat('%', :q, '%'))
               OR lower(u.email) LIKE lower(concat('%', :q, '%')))
        ORDER BY u.username ASC
        """)
    List<User> search(@Param("q") String query, @Param("excludedId") Long excludedId, Pageable pageable);
}
