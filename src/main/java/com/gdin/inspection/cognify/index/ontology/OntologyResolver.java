package com.gdin.inspection.cognify.index.ontology;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.util.DataPointIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.Optional;

/**
 * 把候选实体的自由文本类型映射到本体类。
 * <p>
 * 只依赖 (候选, 快照)。相似度低于阈值视为未命中，类型保持原样并标记为非本体。
 * 多个类同时命中时依次比较：精确匹配、相似度、本体路径深度（越具体越优先）、声明顺序。
 */
@Slf4j
@Service
public class OntologyResolver {

    public static final String DEFAULT_TYPE = "Entity";

    private final double threshold;

    @Autowired
    public OntologyResolver(CognifyProperties properties) {
        this(properties.getOntology().getMatchThreshold());
    }

    public OntologyResolver(double threshold) {
        this.threshold = threshold;
    }

    private record Candidate(OntologyClass cls, boolean exact, double similarity) {
    }

    public ResolvedType resolve(String entityName, String candidateType, OntologySnapshot snapshot) {
        String rawType = StrUtil.isBlank(candidateType) ? DEFAULT_TYPE : candidateType.trim();
        if (snapshot == null || snapshot.isEmpty()) {
            return ResolvedType.builder().typeName(rawType).ontologyValid(false).build();
        }
        String normalized = DataPointIds.normalizeName(rawType);

        Optional<Candidate> best = snapshot.getClasses().stream()
                .map(c -> score(c, normalized))
                .filter(c -> c.exact() || c.similarity() >= threshold)
                .min(Comparator.comparing((Candidate c) -> !c.exact())
                        .thenComparing(Candidate::similarity, Comparator.reverseOrder())
                        .thenComparing(c -> c.cls().depth(), Comparator.reverseOrder())
                        .thenComparingInt(c -> c.cls().getOrder()));

        if (best.isEmpty()) {
            log.debug("本体未命中: entity={}, type={}", entityName, rawType);
            return ResolvedType.builder().typeName(rawType).ontologyValid(false).build();
        }
        Candidate c = best.get();
        return ResolvedType.builder()
                .typeName(c.cls().getName())
                .ontologyValid(true)
                .matchedClass(c.cls())
                .similarity(c.similarity())
                .build();
    }

    private static Candidate score(OntologyClass cls, String normalizedType) {
        String name = DataPointIds.normalizeName(cls.getName());
        if (name.equals(normalizedType)) {
            return new Candidate(cls, true, 1.0);
        }
        return new Candidate(cls, false, StrUtil.similar(name, normalizedType));
    }
}
