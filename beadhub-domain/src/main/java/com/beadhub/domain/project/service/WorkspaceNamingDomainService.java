package com.beadhub.domain.project.service;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 工作区命名领域服务：项目 slug、别名、人名、角色的校验与规范化，以及别名建议。
 */
@Service
public class WorkspaceNamingDomainService {

    private static final Pattern PROJECT_SLUG = Pattern.compile("^[a-z0-9][a-z0-9-]{0,62}$");
    private static final Pattern ALIAS = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9_-]{0,63}$");
    private static final Pattern HUMAN_NAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9 '\\-]{0,63}$");
    private static final Pattern ROLE_WORD = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9_-]*$");
    private static final int ROLE_MAX_LENGTH = 50;
    private static final int ROLE_MAX_WORDS = 2;
    private static final int MAX_ALIAS_SUFFIX = 99;

    static final List<String> CLASSIC_NAMES = List.of(
            "alice", "bob", "charlie", "dave", "eve", "frank", "grace", "henry", "ivy", "jack",
            "kate", "leo", "mia", "noah", "olivia", "peter", "quinn", "rose", "sam", "tara",
            "uma", "victor", "wendy", "xavier", "yara", "zoe");

    public boolean isValidProjectSlug(String slug) {
        return slug != null && PROJECT_SLUG.matcher(slug).matches();
    }

    public boolean isValidAlias(String alias) {
        return alias != null && ALIAS.matcher(alias).matches();
    }

    public boolean isValidHumanName(String humanName) {
        return humanName != null && HUMAN_NAME.matcher(humanName).matches();
    }

    /**
     * 规范化角色：去首尾空白、合并空白、转小写；非法时返回 null。
     */
    public String normalizeRole(String role) {
        if (StringUtils.isBlank(role)) {
            return null;
        }
        String normalized = StringUtils.normalizeSpace(role).toLowerCase(Locale.ROOT);
        if (normalized.length() > ROLE_MAX_LENGTH) {
            return null;
        }
        String[] words = normalized.split(" ");
        if (words.length > ROLE_MAX_WORDS) {
            return null;
        }
        for (String word : words) {
            if (!ROLE_WORD.matcher(word).matches()) {
                return null;
            }
        }
        return normalized;
    }

    /**
     * 在项目已占用别名之外建议一个新别名：先尝试 {classic}-{role}，再尝试带两位序号的变体。
     *
     * @return 建议的别名；全部占用时返回 null
     */
    public String suggestAlias(String normalizedRole, Set<String> takenAliases) {
        String suffix = StringUtils.isBlank(normalizedRole) ? "" : "-" + normalizedRole.replace(' ', '-');
        for (String name : CLASSIC_NAMES) {
            String candidate = name + suffix;
            if (!takenAliases.contains(candidate) && isValidAlias(candidate)) {
                return candidate;
            }
        }
        for (int i = 2; i <= MAX_ALIAS_SUFFIX; i++) {
            for (String name : CLASSIC_NAMES) {
                String candidate = String.format("%s%s-%02d", name, suffix, i);
                if (!takenAliases.contains(candidate) && isValidAlias(candidate)) {
                    return candidate;
                }
            }
        }
        return null;
    }
}
