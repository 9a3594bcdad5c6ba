package com.beadhub.trigger.application.query;

import com.beadhub.api.dto.RepoDTO;
import com.beadhub.api.dto.RepoListResponseDTO;
import com.beadhub.api.dto.RepoLookupResponseDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.project.adapter.repository.IProjectRepository;
import com.beadhub.domain.project.adapter.repository.IRepoRepository;
import com.beadhub.domain.project.model.entity.ProjectEntity;
import com.beadhub.domain.project.model.entity.RepoEntity;
import com.beadhub.domain.project.service.RepoOriginDomainService;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.common.PageCursorCodec;
import com.beadhub.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 仓库读用例：按 origin 查找与分页列表，均限定在调用方项目内。
 */
@Service
public class RepoQueryService {

    private final IRepoRepository repoRepository;
    private final IProjectRepository projectRepository;
    private final RepoOriginDomainService repoOriginDomainService;
    private final PageCursorCodec pageCursorCodec;
    private final CoordinationViewAssembler coordinationViewAssembler;

    public RepoQueryService(IRepoRepository repoRepository,
                            IProjectRepository projectRepository,
                            RepoOriginDomainService repoOriginDomainService,
                            PageCursorCodec pageCursorCodec,
                            CoordinationViewAssembler coordinationViewAssembler) {
        this.repoRepository = repoRepository;
        this.projectRepository = projectRepository;
        this.repoOriginDomainService = repoOriginDomainService;
        this.pageCursorCodec = pageCursorCodec;
        this.coordinationViewAssembler = coordinationViewAssembler;
    }

    public RepoLookupResponseDTO lookup(AuthIdentity identity, String originUrl) {
        if (StringUtils.isBlank(originUrl)) {
            throw AppException.illegalParameter("origin_url is required");
        }
        String canonicalOrigin;
        try {
            canonicalOrigin = repoOriginDomainService.canonicalize(originUrl);
        } catch (IllegalArgumentException ex) {
            throw AppException.illegalParameter(ex.getMessage());
        }
        RepoEntity repo = repoRepository.findByCanonicalOrigin(identity.getProjectId(), canonicalOrigin);
        if (repo == null || repo.isDeleted()) {
            throw AppException.notFound("Repo not found: " + canonicalOrigin);
        }
        ProjectEntity project = projectRepository.findById(repo.getProjectId());

        RepoLookupResponseDTO response = new RepoLookupResponseDTO();
        response.setRepoId(repo.getId());
        response.setProjectId(repo.getProjectId());
        response.setProjectSlug(project == null ? null : project.getSlug());
        response.setCanonicalOrigin(repo.getCanonicalOrigin());
        response.setName(repo.getName());
        return response;
    }

    public RepoListResponseDTO list(AuthIdentity identity, Integer limit, String cursor) {
        int pageSize = pageCursorCodec.normalizeLimit(limit);
        PageCursorCodec.PageCursor after = pageCursorCodec.decode(cursor);
        List<RepoEntity> rows = repoRepository.findActivePage(identity.getProjectId(),
                after == null ? null : after.createdAt(),
                after == null ? null : after.id(),
                pageSize + 1);
        boolean hasMore = rows.size() > pageSize;
        List<RepoEntity> page = hasMore ? rows.subList(0, pageSize) : rows;

        List<RepoDTO> repos = new ArrayList<>();
        for (RepoEntity repo : page) {
            RepoDTO dto = new RepoDTO();
            dto.setId(repo.getId());
            dto.setProjectId(repo.getProjectId());
            dto.setCanonicalOrigin(repo.getCanonicalOrigin());
            dto.setName(repo.getName());
            dto.setCreatedAt(coordinationViewAssembler.formatTime(repo.getCreatedAt()));
            dto.setWorkspaceCount(repo.getWorkspaceCount() == null ? 0 : repo.getWorkspaceCount());
            repos.add(dto);
        }

        RepoListResponseDTO response = new RepoListResponseDTO();
        response.setRepos(repos);
        response.setHasMore(hasMore);
        if (hasMore) {
            RepoEntity last = page.get(page.size() - 1);
            response.setNextCursor(pageCursorCodec.encode(last.getCreatedAt(), last.getId()));
        }
        return response;
    }
}
