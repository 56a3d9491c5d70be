package io.netwatch.registry.service;

import io.netwatch.registry.DatabaseManager;
import io.netwatch.registry.model.LatencyMeasurement;
import io.netwatch.registry.model.LatencyStatistics;
import io.netwatch.registry.repository.LatencyMonitoringRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class LatencyService {
    
    private final LatencyMonitoringRepository repository;
    private final Clock clock;
    
    public LatencyService(DatabaseManager dbManager) {
        this(dbManager, Clock.systemDefaultZone());
    }
    
    public LatencyService(DatabaseManager dbManager, Clock clock) {
        this.repository = new LatencyMonitoringRepository(dbManager);
        this.clock = clock;
    }
    
    public void enable(String ip) {
        repository.setEnabled(ip, true, LocalDateTime.now(clock));
    }
    
    public void disable(String ip) {
        repository.setEnabled(ip, false, LocalDateTime.now(clock));
    }
    
    public boolean isEnabled(String ip) {
        return repository.isEnabled(ip);
    }
    
    public List<String> getEnabledIps() {
        return repository.findEnabledIps();
    }
    
    public Map<String, Boolean> getStatusBatch(Collection<String> ips) {
        return repository.findStatusBatch(ips);
    }
    
    /**
     * @param latencyMs {@code null} records a lost packet
     */
    public LatencyMeasurement record(String ip, Double latencyMs) {
        LatencyMeasurement measurement = new LatencyMeasurement(ip, latencyMs, latencyMs == null, LocalDateTime.now(clock));
        repository.insertMeasurement(measurement);
        return measurement;
    }
    
    public List<LatencyMeasurement> getMeasurements(String ip, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be > 0, got " + days);
        }
        return repository.findMeasurementsSince(ip, LocalDateTime.now(clock).minusDays(days));
    }
    
    /**
     * Averages over the last hour and the last 24 hours; min, max, loss and total over every stored
     * sample of the address. Lost samples never enter the averages.
     */
    public LatencyStatistics getStatistics(String ip) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime hourAgo = now.minusHours(1);
        LocalDateTime dayAgo = now.minusHours(24);
        
        List<LatencyMeasurement> all = repository.findMeasurementsSince(ip, null);
        
        double sum1h = 0;
        int n1h = 0;
        double sum24h = 0;
        int n24h = 0;
        Double min = null;
        Double max = null;
        int lost = 0;
        
        for (LatencyMeasurement m : all) {
            if (m.isPacketLoss()) {
                lost++;
                continue;
            }
            Double latency = m.getLatencyMs();
            if (latency == null) {
                continue;
            }
            min = min == null ? latency : Math.min(min, latency);
            max = max == null ? latency : Math.max(max, latency);
            if (!m.getMeasuredAt().isBefore(dayAgo)) {
                sum24h += latency;
                n24h++;
            }
            if (!m.getMeasuredAt().isBefore(hourAgo)) {
                sum1h += latency;
                n1h++;
            }
        }
        
        double lossPercent = all.isEmpty() ? 0.0 : (lost * 100.0) / all.size();
        return new LatencyStatistics(
            n1h > 0 ? sum1h / n1h : null,
            n24h > 0 ? sum24h / n24h : null,
            min, max, lossPercent, all.size());
    }
}
