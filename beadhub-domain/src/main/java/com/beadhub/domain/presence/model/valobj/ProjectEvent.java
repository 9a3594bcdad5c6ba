package com.beadhub.domain.presence.model.valobj;

import com.beadhub.types.enums.EventTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 项目事件。
 * <p>
 * type 为封闭集合；无法识别的事件 type 为 UNKNOWN，rawType 保留原始类型名，payload 保留原始载荷。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectEvent {

    private EventTypeEnum type;

    private String rawType;

    private String projectId;

    /**
     * 事件相关工作区
     */
    private String workspaceId;

    private Map<String, Object> payload;

    private String occurredAt;

    public String typeName() {
        if (type == null || type == EventTypeEnum.UNKNOWN) {
            return rawType == null ? EventTypeEnum.UNKNOWN.getCode() : rawType;
        }
        return type.getCode();
    }

    public String category() {
        return type == null ? EventTypeEnum.UNKNOWN.getCategory() : type.getCategory();
    }
}
