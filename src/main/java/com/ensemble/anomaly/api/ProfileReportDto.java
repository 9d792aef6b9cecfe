package com.ensemble.anomaly.api;

import com.ensemble.anomaly.domain.CategoryProfile;
import com.ensemble.anomaly.domain.MerchantProfile;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ProfileReportDto {
    List<MerchantProfile> merchants;
    List<CategoryProfile> categories;
}
