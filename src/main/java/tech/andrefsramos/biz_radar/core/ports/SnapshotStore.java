package tech.andrefsramos.biz_radar.core.ports;

import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.BusinessQuery;
import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.domain.ScanRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface SnapshotStore {
    Map<String, Business> getCurrent();
    ScanRecord commit(Map<String, Business> snapshot, ScanRecord scanRecord);
    List<Notification> recordNotifications(List<Notification> notifications);
    ScanRecord commitScan(Map<String, Business> snapshot, ScanRecord scanRecord, List<Notification> notifications);
    ScanRecord recordAbortedScan(ScanRecord scanRecord, List<Notification> notifications);
    List<Notification> findOpenNotifications();
    List<ScanRecord> findScanHistory(int limit);
    Optional<ScanRecord> findLastScan();
    List<Business> findBusinesses(BusinessQuery query);
    boolean setCompetitorFlag(String businessId, boolean competitor);
}
