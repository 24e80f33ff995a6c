package com.questhub.engineservice.domain.model;

import com.questhub.engineservice.engine.core.Snapshot;
import lombok.Data;

@Data
public class LocationState implements Snapshot<LocationState> {
    /** 当前区域ID */
    private String locationId = "town_square";
    private int x;
    private int y;
    /** 最近一次生成的场景插画地址 */
    private String lastImageUrl;
    /** 最近一次生成的剧情文本 */
    private String lastNarrative;

    @Override
    public LocationState copy() {
        LocationState l = new LocationState();
        l.locationId = locationId;
        l.x = x;
        l.y = y;
        l.lastImageUrl = lastImageUrl;
        l.lastNarrative = lastNarrative;
        return l;
    }
}
