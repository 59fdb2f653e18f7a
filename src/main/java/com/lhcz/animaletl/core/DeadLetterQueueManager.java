package com.lhcz.animaletl.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lhcz.animaletl.model.Animal;
import com.lhcz.animaletl.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 死信队列管理器
 * 写入 home 接口最终失败的批次落到本地 JSON 文件，便于人工补录。只写不读，不做断点续传。
 */
public class DeadLetterQueueManager {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueueManager.class);

    private final File dir;
    private final ObjectMapper mapper = JsonUtil.mapper();
    private final AtomicInteger sequence = new AtomicInteger();

    public DeadLetterQueueManager(String dirName) {
        this.dir = new File(dirName);
        if (!dir.exists()) {
            if (dir.mkdirs()) {
                log.info("📂 已创建补录数据目录: {}", dir.getAbsolutePath());
            }
        }
    }

    /**
     * 保存失败批次到磁盘，返回文件；保存失败返回 null
     */
    public File save(String label, List<Animal> batch, String reason) {
        if (batch == null || batch.isEmpty()) return null;

        // failed_标签_时间_序号_原因.json
        String timeStr = new SimpleDateFormat("yyyyMMdd_HHmmss").format(new Date());
        String safeReason = reason == null ? "unknown" : reason.replaceAll("[^a-zA-Z0-9]", "_");
        if (safeReason.length() > 30) safeReason = safeReason.substring(0, 30);

        String fileName = String.format("failed_%s_%s_%03d_%s.json", label, timeStr, sequence.incrementAndGet(), safeReason);
        File file = new File(dir, fileName);

        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(file, JsonUtil.toJsonArray(batch));
            log.error("💾 [补录保存] 写入失败的数据已保存到文件! 路径: {}, 原因: {}", file.getPath(), reason);
            return file;
        } catch (IOException e) {
            log.error("🚨 [严重错误] 无法保存失败数据! 数据可能永久丢失! 批次: {}", label, e);
            return null;
        }
    }

    public File getDir() {
        return dir;
    }
}
