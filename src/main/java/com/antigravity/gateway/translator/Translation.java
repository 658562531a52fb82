package com.antigravity.gateway.translator;

import com.antigravity.gateway.dto.cloudcode.CloudCodePayload;
import com.antigravity.gateway.signature.ModelFamily;

/**
 * 请求转换结果
 * <p>
 * 载荷中的项目 ID 在每次尝试时按账号填入
 *
 * @param payload   Cloud Code 载荷
 * @param model     目标模型
 * @param family    目标模型家族
 * @param sessionId 会话 ID，可能为 null
 * @param thinking  是否为思考模型
 */
public record Translation(CloudCodePayload payload, String model, ModelFamily family,
                          String sessionId, boolean thinking) {}
