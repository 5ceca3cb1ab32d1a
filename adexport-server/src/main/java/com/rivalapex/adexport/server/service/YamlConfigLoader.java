package com.rivalapex.adexport.server.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.rivalapex.adexport.server.dto.GlobalConfig;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * 读取 global.yaml。空文档视为全部缺省；根节点必须是映射；未识别的顶层段落只告警不报错。
 */
@Slf4j
@Component
public class YamlConfigLoader {

    static final Set<String> KNOWN_SECTIONS = Collections.unmodifiableSet(new HashSet<>(
        Arrays.asList("export", "concurrency", "disk_protection", "analytics")));

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public GlobalConfig loadGlobalConfig(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return toGlobalConfig(yamlMapper.readTree(in), resource.getDescription());
        }
    }

    public GlobalConfig loadGlobalConfigFromString(String yaml) throws IOException {
        return toGlobalConfig(yamlMapper.readTree(yaml), "inline yaml");
    }

    private GlobalConfig toGlobalConfig(JsonNode root, String source) throws IOException {
        if (root == null || root.isMissingNode() || root.isNull()) {
            log.warn("全局配置为空，全部使用缺省值: {}", source);
            return new GlobalConfig();
        }
        if (!root.isObject()) {
            throw new IOException("global config root must be a mapping: " + source);
        }
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_SECTIONS.contains(name)) {
                log.warn("忽略未识别的配置段落: {} ({})", name, source);
            }
        }
        return yamlMapper.treeToValue(root, GlobalConfig.class);
    }
}
