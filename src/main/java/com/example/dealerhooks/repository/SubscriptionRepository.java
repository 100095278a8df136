package com.example.dealerhooks.repository;

import com.example.dealerhooks.model.Subscription;
import com.example.dealerhooks.model.WebhookEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 订阅仓储接口。
 * 健康状态相关的更新均为单条 UPDATE 语句，避免先读后写的并发覆盖。
 */
@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    /**
     * 查询订阅了任一给定事件类型的启用订阅。
     *
     * @param types 事件类型（通常为具体事件 + ALL）
     * @return 订阅列表
     */
    @Query("SELECT DISTINCT s FROM Subscription s JOIN s.events e WHERE s.active = true AND e IN :types")
    List<Subscription> findActiveByEventTypes(@Param("types") Collection<WebhookEventType> types);

    List<Subscription> findAllByOrderByCreatedAtDesc();

    long countByActiveTrue();

    /**
     * 投递成功：连续失败次数清零。
     *
     * @return 更新行数
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Subscription s SET s.failureCount = 0, s.lastTriggeredAt = :now WHERE s.id = :id")
    int markSucceeded(@Param("id") Long id, @Param("now") LocalDateTime now);

    /**
     * 投递失败：连续失败次数原子 +1 并记录错误。
     *
     * @return 更新行数
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Subscription s SET s.failureCount = s.failureCount + 1, s.lastError = :error, "
            + "s.lastTriggeredAt = :now WHERE s.id = :id")
    int incrementFailureCount(@Param("id") Long id, @Param("error") String error, @Param("now") LocalDateTime now);

    /**
     * 连续失败达到阈值时停用订阅。
     *
     * @return 1 表示本次完成停用，0 表示未达阈值或已停用
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Subscription s SET s.active = false "
            + "WHERE s.id = :id AND s.active = true AND s.failureCount >= :threshold")
    int deactivateIfThresholdReached(@Param("id") Long id, @Param("threshold") int threshold);
}
