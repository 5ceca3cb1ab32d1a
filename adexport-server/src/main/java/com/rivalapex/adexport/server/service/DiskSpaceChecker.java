package com.rivalapex.adexport.server.service;

import com.rivalapex.adexport.server.dto.GlobalConfig.DiskProtectionConfig;
import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 磁盘水位检查，在生成导出文件前确认导出目录所在磁盘的可用空间。
 */
@Slf4j
@Service
public class DiskSpaceChecker {

    private static final double GB = 1024.0 * 1024.0 * 1024.0;

    /**
     * @return 空间是否充足；保护未启用时总是 true
     */
    public boolean checkDiskSpace(Path path, DiskProtectionConfig protection) {
        if (protection == null || !Boolean.TRUE.equals(protection.getEnabled())) {
            return true;
        }
        try {
            FileStore fileStore = Files.getFileStore(existingAncestor(path));
            long usableSpace = fileStore.getUsableSpace();
            long totalSpace = fileStore.getTotalSpace();
            double usableGb = usableSpace / GB;
            double usablePercent = totalSpace > 0 ? (double) usableSpace / totalSpace * 100 : 0;

            log.debug("磁盘空间检查: path={}, usable={}GB ({}%)", path,
                String.format("%.2f", usableGb), String.format("%.2f", usablePercent));

            if (protection.getMinFreeSpaceGb() != null && usableGb < protection.getMinFreeSpaceGb()) {
                log.error("磁盘可用空间不足: path={}, 需要至少{}GB，当前仅有{}GB",
                    path, protection.getMinFreeSpaceGb(), String.format("%.2f", usableGb));
                return false;
            }
            if (protection.getMinFreeSpacePercent() != null && usablePercent < protection.getMinFreeSpacePercent()) {
                log.error("磁盘可用空间百分比不足: path={}, 需要至少{}%，当前仅有{}%",
                    path, protection.getMinFreeSpacePercent(), String.format("%.2f", usablePercent));
                return false;
            }
            return true;
        } catch (IOException e) {
            log.error("检查磁盘空间失败: path={}", path, e);
            return !Boolean.TRUE.equals(protection.getFailOnCheckError());
        }
    }

    private Path existingAncestor(Path path) {
        Path current = path.toAbsolutePath().normalize();
        while (current != null && !Files.exists(current)) {
            current = current.getParent();
        }
        return current != null ? current : Paths.get(".").toAbsolutePath().normalize();
    }
}
