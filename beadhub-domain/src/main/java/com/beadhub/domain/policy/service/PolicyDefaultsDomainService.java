package com.beadhub.domain.policy.service;

import com.beadhub.domain.policy.model.valobj.PolicyBundle;
import com.beadhub.domain.policy.model.valobj.PolicyInvariant;
import com.beadhub.domain.policy.model.valobj.RolePlaybook;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 默认策略包领域服务。
 * <p>
 * 默认不变量与角色手册以带 YAML front matter 的 markdown 文件形式放在 classpath 的
 * {@code defaults/invariants} 与 {@code defaults/roles} 下，首次使用时加载并缓存，每次返回副本。
 * </p>
 */
@Slf4j
@Service
public class PolicyDefaultsDomainService {

    static final String INVARIANTS_PATTERN = "classpath*:defaults/invariants/*.md";
    static final String ROLES_PATTERN = "classpath*:defaults/roles/*.md";
    private static final String DELIMITER = "---";

    private final ResourcePatternResolver resolver;
    private final Supplier<PolicyBundle> cachedBundle;

    public PolicyDefaultsDomainService() {
        this(new PathMatchingResourcePatternResolver());
    }

    public PolicyDefaultsDomainService(ResourcePatternResolver resolver) {
        this.resolver = resolver;
        this.cachedBundle = Suppliers.memoize(this::loadBundle);
    }

    public PolicyBundle defaultBundle() {
        return cachedBundle.get().copy();
    }

    private PolicyBundle loadBundle() {
        PolicyBundle bundle = new PolicyBundle();
        Set<String> invariantIds = new HashSet<>();
        for (Resource resource : resources(INVARIANTS_PATTERN)) {
            Document document = readDocument(resource);
            if (!invariantIds.add(document.id())) {
                throw new IllegalStateException("Duplicate default invariant id: " + document.id());
            }
            bundle.getInvariants().add(new PolicyInvariant(document.id(), document.title(), document.body()));
        }
        Map<String, RolePlaybook> roles = new LinkedHashMap<>();
        for (Resource resource : resources(ROLES_PATTERN)) {
            Document document = readDocument(resource);
            if (roles.containsKey(document.id())) {
                throw new IllegalStateException("Duplicate default role id: " + document.id());
            }
            roles.put(document.id(), new RolePlaybook(document.title(), document.body()));
        }
        bundle.setRoles(roles);
        log.info("Default policy bundle loaded. invariants={}, roles={}", bundle.getInvariants().size(), roles.size());
        return bundle;
    }

    private Resource[] resources(String pattern) {
        try {
            Resource[] resources = resolver.getResources(pattern);
            Arrays.sort(resources, Comparator.comparing(r -> String.valueOf(r.getFilename())));
            return resources;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to list default policy documents: " + pattern, ex);
        }
    }

    private Document readDocument(Resource resource) {
        String content;
        try (InputStream in = resource.getInputStream()) {
            content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read default policy document: " + resource.getFilename(), ex);
        }
        return parseDocument(resource.getFilename(), content);
    }

    /**
     * 解析 front matter；id 与 title 必须为字符串。
     */
    Document parseDocument(String name, String content) {
        String text = content.strip();
        if (!text.startsWith(DELIMITER)) {
            throw new IllegalStateException(name + " is missing YAML front matter");
        }
        int end = text.indexOf(DELIMITER, DELIMITER.length());
        if (end < 0) {
            throw new IllegalStateException(name + " has unterminated YAML front matter");
        }
        Object parsed;
        try {
            parsed = new Yaml().load(text.substring(DELIMITER.length(), end));
        } catch (YAMLException ex) {
            throw new IllegalStateException(name + " has invalid YAML front matter", ex);
        }
        if (!(parsed instanceof Map<?, ?> frontMatter)) {
            throw new IllegalStateException(name + " front matter must be a mapping");
        }
        if (!(frontMatter.get("id") instanceof String id) || id.isBlank()) {
            throw new IllegalStateException(name + " is missing string 'id'");
        }
        if (!(frontMatter.get("title") instanceof String title)) {
            throw new IllegalStateException(name + " is missing string 'title'");
        }
        return new Document(id, title, text.substring(end + DELIMITER.length()).strip());
    }

    record Document(String id, String title, String body) {
    }
}
