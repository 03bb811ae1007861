package tech.andrefsramos.biz_radar.core.policy;

import tech.andrefsramos.biz_radar.core.domain.Business;

/*
 * Popularidade do upstream (0–1). Limiar típico: 0.15.
 */
public class PopularityDeltaSignal implements TrendingSignal {

    @Override
    public String name() {
        return "popularity";
    }

    @Override
    public Double level(Business business) {
        return business == null ? null : business.popularity();
    }
}
