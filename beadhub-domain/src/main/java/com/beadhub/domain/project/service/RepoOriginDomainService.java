package com.beadhub.domain.project.service;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 仓库 origin 领域服务：把各种 git URL 形式规范化为 host/path。
 * <ul>
 *   <li>git@github.com:org/repo.git -> github.com/org/repo</li>
 *   <li>https://github.com/org/repo.git -> github.com/org/repo</li>
 *   <li>ssh://git@github.com:22/org/repo.git -> github.com/org/repo</li>
 * </ul>
 */
@Service
public class RepoOriginDomainService {

    private static final Pattern SCP_LIKE = Pattern.compile("^[^@/\\s]+@([^:/\\s]+):(.+)$");
    private static final Pattern CANONICAL_ORIGIN =
            Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9._-]*(/[a-zA-Z0-9][a-zA-Z0-9._-]*)*$");
    private static final int MAX_ORIGIN_LENGTH = 255;

    public String canonicalize(String originUrl) {
        if (StringUtils.isBlank(originUrl)) {
            throw new IllegalArgumentException("Empty origin URL");
        }
        String url = originUrl.trim();
        String host;
        String path;
        Matcher scp = SCP_LIKE.matcher(url);
        if (scp.matches()) {
            host = scp.group(1);
            path = scp.group(2);
        } else {
            URI uri;
            try {
                uri = new URI(url);
            } catch (URISyntaxException ex) {
                throw new IllegalArgumentException("Invalid git URL: " + originUrl);
            }
            if (uri.getScheme() == null || uri.getHost() == null) {
                if (isCanonical(url)) {
                    return stripSuffixes(url);
                }
                throw new IllegalArgumentException("Invalid git URL: " + originUrl);
            }
            host = uri.getHost();
            path = uri.getPath();
        }

        String normalizedPath = stripSuffixes(StringUtils.strip(StringUtils.defaultString(path), "/"));
        if (StringUtils.isBlank(normalizedPath)) {
            throw new IllegalArgumentException("Git URL has no path: " + originUrl);
        }
        String canonical = host.toLowerCase(Locale.ROOT) + "/" + normalizedPath;
        if (!isCanonical(canonical)) {
            throw new IllegalArgumentException("Invalid git URL: " + originUrl);
        }
        return canonical;
    }

    public boolean isCanonical(String origin) {
        return StringUtils.isNotBlank(origin)
                && origin.length() <= MAX_ORIGIN_LENGTH
                && CANONICAL_ORIGIN.matcher(origin).matches();
    }

    /**
     * 仓库名为 canonical origin 的最后一段。
     */
    public String extractRepoName(String canonicalOrigin) {
        return StringUtils.substringAfterLast("/" + canonicalOrigin, "/");
    }

    private String stripSuffixes(String path) {
        String value = StringUtils.stripEnd(path, "/");
        if (value.endsWith(".git")) {
            value = value.substring(0, value.length() - 4);
        }
        return StringUtils.stripEnd(value, "/");
    }
}
