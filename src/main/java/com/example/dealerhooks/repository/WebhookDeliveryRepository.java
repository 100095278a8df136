package com.example.dealerhooks.repository;

import com.example.dealerhooks.model.DeliveryStatus;
import com.example.dealerhooks.model.WebhookDelivery;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 投递台账仓储接口。
 * 状态变更语句都带有 status <> SUCCESS 条件，成功记录不会被改写。
 */
@Repository
public interface WebhookDeliveryRepository extends JpaRepository<WebhookDelivery, Long> {

    List<WebhookDelivery> findBySubscriptionIdOrderByCreatedAtDescIdDesc(Long subscriptionId, Pageable pageable);

    long countBySubscriptionId(Long subscriptionId);

    long countBySubscriptionIdAndStatus(Long subscriptionId, DeliveryStatus status);

    long countByStatus(DeliveryStatus status);

    Optional<WebhookDelivery> findFirstBySubscriptionIdOrderByCreatedAtDescIdDesc(Long subscriptionId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookDelivery d SET d.status = com.example.dealerhooks.model.DeliveryStatus.SUCCESS, "
            + "d.responseStatus = :responseStatus, d.responseBody = :responseBody, d.errorMessage = null, "
            + "d.deliveredAt = :deliveredAt "
            + "WHERE d.id = :id AND d.status <> com.example.dealerhooks.model.DeliveryStatus.SUCCESS")
    int markSucceeded(@Param("id") Long id,
                      @Param("responseStatus") int responseStatus,
                      @Param("responseBody") String responseBody,
                      @Param("deliveredAt") LocalDateTime deliveredAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookDelivery d SET d.status = com.example.dealerhooks.model.DeliveryStatus.FAILED, "
            + "d.responseStatus = :responseStatus, d.errorMessage = :errorMessage "
            + "WHERE d.id = :id AND d.status <> com.example.dealerhooks.model.DeliveryStatus.SUCCESS")
    int markFailed(@Param("id") Long id,
                   @Param("responseStatus") Integer responseStatus,
                   @Param("errorMessage") String errorMessage);

    /**
     * 手动重投计数 +1，仅当记录未成功且未达上限。
     *
     * @return 1 表示占用了一次重投额度
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookDelivery d SET d.retryCount = d.retryCount + 1 "
            + "WHERE d.id = :id AND d.retryCount < :limit "
            + "AND d.status <> com.example.dealerhooks.model.DeliveryStatus.SUCCESS")
    int claimManualRetry(@Param("id") Long id, @Param("limit") int limit);
}
