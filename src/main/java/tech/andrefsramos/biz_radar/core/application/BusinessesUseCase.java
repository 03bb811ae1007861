package tech.andrefsramos.biz_radar.core.application;

import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.BusinessQuery;
import tech.andrefsramos.biz_radar.core.domain.CompetitorSummary;

import java.util.List;

public interface BusinessesUseCase {
    List<Business> list(BusinessQuery query);
    void setCompetitorFlag(String businessId, boolean competitor);
    CompetitorSummary competitorSummary();
}
