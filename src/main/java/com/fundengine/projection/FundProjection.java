package com.fundengine.projection;

import com.fundengine.domain.model.ProjectionPeriod;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FundProjection {

    String fundId;
    String fundName;
    String strategy;
    List<ProjectionPeriod> periods;
}
