package com.beadhub.domain.presence.adapter.gateway;

import com.beadhub.domain.presence.model.valobj.ProjectEvent;

import java.util.function.Consumer;

/**
 * 项目事件广播访问器，发后即忘。
 *
 * @author beadhub
 * @since 2026-01-12
 */
public interface IProjectEventGateway {

    /**
     * 发布事件；失败只记录日志，不向调用方抛出
     */
    void publish(ProjectEvent event);

    /**
     * 订阅项目事件，返回的句柄关闭时释放底层订阅
     */
    AutoCloseable subscribe(String projectId, Consumer<ProjectEvent> listener);
}
