package com.beadhub.trigger.http;

import com.beadhub.api.dto.InitRequestDTO;
import com.beadhub.api.dto.InitResponseDTO;
import com.beadhub.api.response.Response;
import com.beadhub.domain.auth.adapter.gateway.IRateLimitGateway;
import com.beadhub.trigger.application.command.InitCommandService;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * 原子初始化 API：项目、仓库、工作区、API Key 一次性落库。
 * <p>该路径免鉴权，按客户端地址做固定窗口限流。</p>
 */
@Slf4j
@RestController
public class InitController {

    private final InitCommandService initCommandService;
    private final IRateLimitGateway rateLimitGateway;

    @Value("${beadhub.init.rate-limit.max-requests:10}")
    private int maxRequests;

    @Value("${beadhub.init.rate-limit.window-seconds:60}")
    private int windowSeconds;

    public InitController(InitCommandService initCommandService,
                          IRateLimitGateway rateLimitGateway) {
        this.initCommandService = initCommandService;
        this.rateLimitGateway = rateLimitGateway;
    }

    @PostMapping("/v1/init")
    public Response<InitResponseDTO> init(@RequestBody InitRequestDTO request, HttpServletRequest servletRequest) {
        String clientAddress = resolveClientAddress(servletRequest);
        if (!rateLimitGateway.tryAcquire("init:" + clientAddress, maxRequests, windowSeconds)) {
            log.warn("Init rate limited. client={}", clientAddress);
            throw new AppException(ResponseCode.RATE_LIMITED, "Too many init requests, retry later");
        }
        if (request == null) {
            throw AppException.illegalParameter("Request body is required");
        }
        return success(initCommandService.init(request));
    }

    private String resolveClientAddress(HttpServletRequest request) {
        return StringUtils.defaultIfBlank(request.getRemoteAddr(), "unknown");
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
