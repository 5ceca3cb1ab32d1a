package com.rivalapex.adexport.dao;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 数仓同步配置仓储接口。
 */
public interface WarehouseSyncRepository {

    WarehouseSyncEntity create(WarehouseSyncEntity entity);

    boolean update(WarehouseSyncEntity entity);

    Optional<WarehouseSyncEntity> findById(String id);

    List<WarehouseSyncEntity> findByPublisherId(String publisherId);

    /**
     * 查询到期且未暂停的同步配置，按 next_sync_time 升序。执行锁在 staleBefore 之前获取的视为已失效，一并返回。
     */
    List<WarehouseSyncEntity> findDue(LocalDateTime now, LocalDateTime staleBefore);

    /**
     * 尝试获取执行锁。未上锁，或锁获取时间早于 staleBefore（持有者已异常退出）时获取成功。
     *
     * @return 是否获取成功
     */
    boolean tryAcquire(String id, LocalDateTime now, LocalDateTime staleBefore);

    /**
     * 释放执行锁并清空锁获取时间。
     */
    void release(String id);
}
