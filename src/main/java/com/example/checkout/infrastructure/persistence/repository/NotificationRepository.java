package com.example.checkout.infrastructure.persistence.repository;

import com.example.checkout.infrastructure.persistence.entity.NotificationEntity;
import com.example.checkout.infrastructure.persistence.entity.NotificationTypeEnum;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA Repository for operator notifications.
 */
@Repository
public interface NotificationRepository extends JpaRepository<NotificationEntity, Long> {

    List<NotificationEntity> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<NotificationEntity> findByReadFalseOrderByCreatedAtDesc(Pageable pageable);

    List<NotificationEntity> findByOrderIdOrderByCreatedAtAsc(String orderId);

    long countByTypeAndOrderId(NotificationTypeEnum type, String orderId);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE NotificationEntity n SET n.read = true WHERE n.id = :id")
    int markRead(@Param("id") Long id);
}
