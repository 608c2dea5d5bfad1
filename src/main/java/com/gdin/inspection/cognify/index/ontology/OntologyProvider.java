package com.gdin.inspection.cognify.index.ontology;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.exception.FatalPipelineException;
import com.gdin.inspection.cognify.util.IOUtil;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * 启动时从配置的文件加载本体快照；未配置时使用空快照。
 */
@Slf4j
@Component
public class OntologyProvider {

    @Resource
    private ResourceLoader resourceLoader;

    @Resource
    private CognifyProperties cognifyProperties;

    private volatile OntologySnapshot snapshot = OntologySnapshot.empty();

    @PostConstruct
    public void init() {
        String file = cognifyProperties.getOntology().getFile();
        if (StrUtil.isBlank(file)) {
            log.info("未配置本体文件，实体类型不做本体校验");
            return;
        }
        org.springframework.core.io.Resource resource = resourceLoader.getResource(file);
        try (InputStream is = resource.getInputStream()) {
            OntologySnapshot.Document doc = IOUtil.jsonDeserializeWithNoType(is, OntologySnapshot.Document.class);
            snapshot = OntologySnapshot.of(doc.getClasses());
            log.info("本体加载完成: file={}, classes={}", file, snapshot.getClasses().size());
        } catch (IOException e) {
            throw new FatalPipelineException("本体文件加载失败: " + file, e);
        }
    }

    public OntologySnapshot snapshot() {
        return snapshot;
    }
}
