package com.rivalapex.adexport.dao;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 导出作业仓储接口，支持内存和数据库两种实现。
 */
public interface ExportJobRepository {

    /**
     * 新增作业记录，id 由调用方生成。
     */
    ExportJobEntity create(ExportJobEntity entity);

    /**
     * 更新作业的可变字段（状态、计数、位置、错误、完成时间）。
     *
     * @return 是否命中记录
     */
    boolean update(ExportJobEntity entity);

    Optional<ExportJobEntity> findById(String id);

    /**
     * 按发布者查询作业，按创建时间倒序。
     */
    List<ExportJobEntity> findByPublisherId(String publisherId, int limit);

    /**
     * 按状态查询作业，用于启动时恢复未结束的作业。
     */
    List<ExportJobEntity> findByStatusIn(Collection<String> statuses);
}
