package com.questhub.engineservice.domain.model;

import lombok.Data;

@Data
public class SessionSettings {
    /** easy / normal / hard */
    private String difficulty = "normal";
    /** 是否参与后台自动保存 */
    private boolean autoSave = true;
    /** 剧情生成风格，透传给 AI 服务 */
    private String narrativeStyle = "classic";
    /** 随机种子；为空时创建会话随机生成，固定后战斗结果可复现 */
    private Long seed;
}
