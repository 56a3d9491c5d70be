package io.netwatch.runner;

import io.netwatch.discovery.range.InvalidRangeException;
import io.netwatch.discovery.resolve.vendor.OuiFileImporter;
import io.netwatch.discovery.scan.NetworkScanService;
import io.netwatch.discovery.scan.ScanFailedException;
import io.netwatch.discovery.scan.ScanMode;
import io.netwatch.discovery.scan.ScanSummary;
import io.netwatch.registry.DatabaseManager;
import io.netwatch.registry.RegistryException;
import io.netwatch.registry.model.DeviceRecord;
import io.netwatch.registry.model.DeviceStatus;
import io.netwatch.registry.model.HistoryBucket;
import io.netwatch.registry.model.HistoryEntry;
import io.netwatch.registry.model.RetentionConfig;
import io.netwatch.registry.query.DeviceQuery;
import io.netwatch.registry.query.SortField;
import io.netwatch.registry.query.SortOrder;
import io.netwatch.registry.repository.VendorRepository;
import io.netwatch.registry.service.DeviceQueryService;
import io.netwatch.registry.service.DeviceReconciler;
import io.netwatch.registry.service.LatencyService;
import io.netwatch.registry.service.RetentionService;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * One-shot commands of the command line. Results go to {@code out} as JSON; diagnostics go to
 * the log.
 */
public class ScanCommands {

    private static final Logger logger = LoggerFactory.getLogger(ScanCommands.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    static final String USAGE_TEXT = String.join("\n",
        "Usage: <command> [arguments]",
        "  scan <range> [full|quick]      scan a CIDR (/16-/24), a dash range or one address",
        "  refresh [full|quick]           re-probe every known device",
        "  watch                          run refresh, latency and purge schedulers until stopped",
        "  devices [--status s] [--search text] [--sort field] [--order asc|desc] [--limit n] [--offset n]",
        "  device <ip>                    show one device",
        "  forget <ip>                    remove one device",
        "  stats                          device counts and last scan time",
        "  timeline [hours]               15 minute buckets of the last hours (default 24)",
        "  history <ip> [limit]           status history of one device (default 100)",
        "  purge                          apply the retention policies now",
        "  compact                        reclaim storage",
        "  diagnostics                    row counts and approximate size",
        "  retention [json]               show, or replace with the given JSON, the retention config",
        "  latency enable|disable|stats <ip>",
        "  import-oui <file>              replace the vendor table from an IEEE oui.txt");

    private final DatabaseManager dbManager;
    private final Supplier<NetworkScanService> scanServices;
    private final PrintStream out;

    public ScanCommands(DatabaseManager dbManager, Supplier<NetworkScanService> scanServices, PrintStream out) {
        this.dbManager = dbManager;
        this.scanServices = scanServices;
        this.out = out;
    }

    public int execute(String[] args) {
        if (args.length == 0) {
            out.println(USAGE_TEXT);
            return USAGE;
        }

        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            switch (command) {
                case "scan":
                    return scan(rest);
                case "refresh":
                    return refresh(rest);
                case "devices":
                    return devices(rest);
                case "device":
                    return device(rest);
                case "forget":
                    return forget(rest);
                case "stats":
                    print(JsonViews.stats(new DeviceQueryService(dbManager).getStats()));
                    return OK;
                case "timeline":
                    return timeline(rest);
                case "history":
                    return history(rest);
                case "purge":
                    print(JsonViews.purge(new RetentionService(dbManager).executePurge()));
                    return OK;
                case "compact":
                    new RetentionService(dbManager).compact();
                    print(new JSONObject().put("compacted", true));
                    return OK;
                case "diagnostics":
                    print(JsonViews.database(new RetentionService(dbManager).getDatabaseStats()));
                    return OK;
                case "retention":
                    return retention(rest);
                case "latency":
                    return latency(rest);
                case "import-oui":
                    return importOui(rest);
                default:
                    out.println("Unknown command: " + command);
                    out.println(USAGE_TEXT);
                    return USAGE;
            }
        } catch (InvalidRangeException e) {
            out.println(new JSONObject().put("error", e.getMessage()));
            return USAGE;
        } catch (ScanFailedException e) {
            logger.error("Scan finished with unsaved results", e);
            out.println(JsonViews.summary(e.getSummary()).put("error", e.getMessage()));
            return FAILED;
        } catch (RegistryException e) {
            logger.error("Command {} failed", command, e);
            out.println(new JSONObject().put("error", e.getMessage()));
            return FAILED;
        } catch (IllegalArgumentException | JSONException e) {
            out.println(new JSONObject().put("error", e.getMessage()));
            return USAGE;
        }
    }

    private int scan(List<String> args) {
        if (args.isEmpty()) {
            return usage("scan needs a range");
        }
        ScanMode mode = ScanMode.fromValue(args.size() > 1 ? args.get(1) : "full");
        try (NetworkScanService service = scanServices.get()) {
            ScanSummary summary = service.scanRange(args.get(0), mode);
            print(JsonViews.summary(summary));
        }
        return OK;
    }

    private int refresh(List<String> args) {
        ScanMode mode = ScanMode.fromValue(args.isEmpty() ? "quick" : args.get(0));
        try (NetworkScanService service = scanServices.get()) {
            print(JsonViews.summary(service.refreshKnown(mode)));
        }
        return OK;
    }

    private int devices(List<String> args) {
        DeviceQuery query = DeviceQuery.all();
        SortField sortField = null;
        SortOrder sortOrder = null;
        Integer limit = null;
        Integer offset = null;

        for (int i = 0; i < args.size(); i++) {
            String option = args.get(i);
            if (i + 1 >= args.size()) {
                return usage("Missing value for " + option);
            }
            String value = args.get(++i);
            switch (option) {
                case "--status":
                    query.status(DeviceStatus.fromValue(value));
                    break;
                case "--search":
                    query.search(value);
                    break;
                case "--ip":
                    query.ipPrefix(value);
                    break;
                case "--sort":
                    sortField = SortField.fromValue(value);
                    break;
                case "--order":
                    sortOrder = SortOrder.fromValue(value);
                    break;
                case "--limit":
                    limit = Integer.parseInt(value);
                    break;
                case "--offset":
                    offset = Integer.parseInt(value);
                    break;
                default:
                    return usage("Unknown option " + option);
            }
        }
        query.sortBy(sortField, sortOrder).page(limit, offset);

        DeviceQueryService queries = new DeviceQueryService(dbManager);
        JSONArray items = new JSONArray();
        for (DeviceRecord device : queries.find(query)) {
            items.put(JsonViews.device(device));
        }
        print(new JSONObject().put("total", queries.count(query)).put("items", items));
        return OK;
    }

    private int device(List<String> args) {
        if (args.isEmpty()) {
            return usage("device needs an address");
        }
        return new DeviceQueryService(dbManager).findByIp(args.get(0))
            .map(device -> {
                print(JsonViews.device(device));
                return OK;
            })
            .orElseGet(() -> notFound(args.get(0)));
    }

    private int forget(List<String> args) {
        if (args.isEmpty()) {
            return usage("forget needs an address");
        }
        if (!new DeviceReconciler(dbManager).forget(args.get(0))) {
            return notFound(args.get(0));
        }
        print(new JSONObject().put("removed", args.get(0)));
        return OK;
    }

    private int timeline(List<String> args) {
        int hours = args.isEmpty() ? 24 : Integer.parseInt(args.get(0));
        JSONArray buckets = new JSONArray();
        for (HistoryBucket bucket : new DeviceQueryService(dbManager).getHistoricalStats(hours)) {
            buckets.put(JsonViews.bucket(bucket));
        }
        print(new JSONObject().put("hours", hours).put("buckets", buckets));
        return OK;
    }

    private int history(List<String> args) {
        if (args.isEmpty()) {
            return usage("history needs an address");
        }
        int limit = args.size() > 1 ? Integer.parseInt(args.get(1)) : 100;
        JSONArray entries = new JSONArray();
        for (HistoryEntry entry : new DeviceQueryService(dbManager).getHistory(args.get(0), limit)) {
            entries.put(JsonViews.history(entry));
        }
        print(new JSONObject().put("ip", args.get(0)).put("history", entries));
        return OK;
    }

    private int retention(List<String> args) {
        RetentionService retention = new RetentionService(dbManager);
        if (!args.isEmpty()) {
            RetentionConfig config = RetentionConfig.fromJson(String.join(" ", args));
            retention.saveConfig(config);
        }
        print(new JSONObject(retention.getConfig().toJson()));
        return OK;
    }

    private int latency(List<String> args) {
        if (args.size() < 2) {
            return usage("latency needs an action and an address");
        }
        LatencyService latency = new LatencyService(dbManager);
        String ip = args.get(1);
        switch (args.get(0)) {
            case "enable":
                latency.enable(ip);
                print(new JSONObject().put("ip", ip).put("enabled", true));
                return OK;
            case "disable":
                latency.disable(ip);
                print(new JSONObject().put("ip", ip).put("enabled", false));
                return OK;
            case "stats":
                print(JsonViews.latency(ip, latency.getStatistics(ip)));
                return OK;
            default:
                return usage("Unknown latency action " + args.get(0));
        }
    }

    private int importOui(List<String> args) {
        if (args.isEmpty()) {
            return usage("import-oui needs a file");
        }
        try {
            int count = new OuiFileImporter(new VendorRepository(dbManager)).importFile(Paths.get(args.get(0)));
            print(new JSONObject().put("imported", count));
            return OK;
        } catch (IOException e) {
            logger.error("Failed to import {}", args.get(0), e);
            out.println(new JSONObject().put("error", e.getMessage()));
            return FAILED;
        }
    }

    private int usage(String message) {
        out.println(message);
        out.println(USAGE_TEXT);
        return USAGE;
    }

    private int notFound(String ip) {
        out.println(new JSONObject().put("error", "Device not found: " + ip));
        return FAILED;
    }

    private void print(JSONObject json) {
        out.println(json.toString(2));
    }
}
