package tech.andrefsramos.biz_radar.core.ports;

import tech.andrefsramos.biz_radar.core.domain.BusinessCategory;
import tech.andrefsramos.biz_radar.core.domain.FetchResult;
import tech.andrefsramos.biz_radar.core.exception.PlacesApiException;

import java.util.Set;

public interface PlacesPort {
    FetchResult fetchNearby(double latitude, double longitude, int radiusMeters,
                            Set<BusinessCategory> categories) throws PlacesApiException;
}
