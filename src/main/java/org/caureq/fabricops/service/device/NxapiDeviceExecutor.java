package org.caureq.fabricops.service.device;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fabricops.config.NxapiProps;
import org.caureq.fabricops.domain.DeviceDescriptor;
import org.caureq.fabricops.domain.DeviceState;
import org.caureq.fabricops.domain.PortStatus;
import org.caureq.fabricops.service.error.*;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeoutException;

/**
 * Cisco NX-API (JSON-RPC over HTTPS, endpoint {@code /ins}) transport.
 * Commands of one call are sent as one batch; NX-OS runs them in order and stops at the first error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "fabric.executor", havingValue = "nxapi")
public class NxapiDeviceExecutor implements DeviceExecutor {
    static final MediaType JSON_RPC = MediaType.valueOf("application/json-rpc");

    private final NxapiProps props;
    private final WebClient nxapiWebClient;
    private final ObjectMapper om = new ObjectMapper();

    @PostConstruct
    void checkCredentials() {
        var pwd = props.password() == null ? "" : props.password();
        var masked = pwd.length() <= 2 ? "********" : pwd.substring(0, 2) + "********";
        log.info("[NX-API] user={} password={} scheme={}", props.username(), masked, props.scheme());
    }

    /* --------------------- state read --------------------- */

    @Override
    public DeviceState readState(DeviceDescriptor device, String iface, Duration timeout) {
        var replies = call(device, List.of(
                "show interface " + iface,
                "show interface " + iface + " switchport",
                "show mac address-table interface " + iface
        ), Stage.PRECHECK, timeout);

        var ifReply = replies.get(0);
        if (ifReply.has("error")) {
            // NX-OS répond "Invalid interface format" / "Invalid range" quand le port n'existe pas
            log.debug("[NX-API] {} {} -> {}", device.name(), iface, errorMessage(ifReply));
            return DeviceState.missing();
        }
        var ifRow = firstRow(ifReply.path("result").path("body"), "TABLE_interface", "ROW_interface");
        var swRow = replies.size() > 1 && !replies.get(1).has("error")
                ? firstRow(replies.get(1).path("result").path("body"), "TABLE_interface", "ROW_interface")
                : om.createObjectNode();

        Map<String, String> config = new LinkedHashMap<>();
        putIfPresent(config, "description", ifRow.path("desc"));
        putIfPresent(config, "mode", swRow.path("oper_mode"));
        putIfPresent(config, "vlan", swRow.path("access_vlan"));
        putIfPresent(config, "trunk_vlans", swRow.path("trunk_vlans"));
        putIfPresent(config, "speed", ifRow.path("eth_speed"));
        putIfPresent(config, "duplex", ifRow.path("eth_duplex"));

        Set<String> macs = new TreeSet<>();
        if (replies.size() > 2 && !replies.get(2).has("error")) {
            for (var row : rows(replies.get(2).path("result").path("body"), "TABLE_mac_address", "ROW_mac_address")) {
                var mac = row.path("disp_mac_addr").asText("");
                if (!mac.isBlank()) macs.add(normalizeMac(mac));
            }
        }

        return new DeviceState(true,
                PortStatus.parse(ifRow.path("admin_state").asText(null)),
                PortStatus.parse(ifRow.path("state").asText(null)),
                config, macs);
    }

    /* --------------------- config push --------------------- */

    @Override
    public void applyCommands(DeviceDescriptor device, List<String> commands, Duration timeout) {
        var lines = commands.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
        if (lines.isEmpty()) return;
        var replies = call(device, lines, Stage.APPLY, timeout);
        for (int i = 0; i < replies.size(); i++) {
            var r = replies.get(i);
            if (r.has("error")) {
                var at = i < lines.size() ? lines.get(i) : "?";
                throw new DeviceRejectedException(device.name(), "'" + at + "': " + errorMessage(r));
            }
        }
        log.info("[NX-API] {} accepted {} line(s)", device.name(), lines.size());
    }

    /* --------------------- transport --------------------- */

    List<JsonNode> call(DeviceDescriptor device, List<String> cmds, Stage stage, Duration timeout) {
        ArrayNode batch = om.createArrayNode();
        for (int i = 0; i < cmds.size(); i++) {
            var req = batch.addObject();
            req.put("jsonrpc", "2.0");
            req.put("method", "cli");
            req.putObject("params").put("cmd", cmds.get(i)).put("version", 1);
            req.put("id", i + 1);
        }
        var url = props.baseUrl(device.address()) + "/ins";

        Mono<JsonNode> mono = nxapiWebClient.post()
                .uri(url)
                .headers(h -> {
                    if (props.username() != null) h.setBasicAuth(props.username(), props.password() == null ? "" : props.password());
                })
                .contentType(JSON_RPC)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(batch)
                .exchangeToMono(resp -> resp.bodyToMono(String.class).defaultIfEmpty("").flatMap(body -> {
                    int status = resp.statusCode().value();
                    if (status == 401 || status == 403) {
                        return Mono.<JsonNode>error(new DeviceUnreachableException(stage, device.name(),
                                "NX-API authentication refused by " + device.name() + " (" + status + ")", null));
                    }
                    // NX-API renvoie 500 avec un corps JSON-RPC quand une commande échoue
                    if (!resp.statusCode().is2xxSuccessful() && !body.trim().startsWith("{") && !body.trim().startsWith("[")) {
                        return Mono.<JsonNode>error(new DeviceUnreachableException(stage, device.name(),
                                "NX-API error " + status + (body.isBlank() ? "" : " -> " + body), null));
                    }
                    try {
                        return Mono.just(om.readTree(body));
                    } catch (IOException e) {
                        return Mono.<JsonNode>error(new DeviceUnreachableException(stage, device.name(),
                                "unreadable NX-API reply from " + device.name(), e));
                    }
                }))
                .timeout(timeout);

        JsonNode reply;
        try {
            reply = mono.block();
        } catch (FabricOpsException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new DeviceTimeoutException(stage, device.name(), timeout, cause);
            }
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new ChangeCancelledException(stage, device.name(), null);
            }
            if (cause instanceof WebClientRequestException || cause instanceof IOException) {
                throw new DeviceUnreachableException(stage, device.name(),
                        "cannot reach " + device.address() + ": " + cause.getMessage(), cause);
            }
            throw new DeviceUnreachableException(stage, device.name(), String.valueOf(cause.getMessage()), cause);
        }
        if (reply == null) {
            throw new DeviceUnreachableException(stage, device.name(), "empty NX-API reply from " + device.name(), null);
        }
        return orderById(reply);
    }

    /* --------------------- utils --------------------- */

    private static List<JsonNode> orderById(JsonNode reply) {
        List<JsonNode> out = new ArrayList<>();
        if (reply.isArray()) reply.forEach(out::add); else out.add(reply);
        out.sort(Comparator.comparingInt(n -> n.path("id").asInt(Integer.MAX_VALUE)));
        return out;
    }

    private static String errorMessage(JsonNode reply) {
        var err = reply.path("error");
        var msg = err.path("data").path("msg").asText("");
        if (msg.isBlank()) msg = err.path("message").asText("unknown error");
        return msg.trim();
    }

    /** NX-OS returns a single object instead of an array when a table has one row. */
    private static List<JsonNode> rows(JsonNode body, String table, String row) {
        var r = body.path(table).path(row);
        if (r.isMissingNode() || r.isNull()) return List.of();
        List<JsonNode> out = new ArrayList<>();
        if (r.isArray()) r.forEach(out::add); else out.add(r);
        return out;
    }

    private JsonNode firstRow(JsonNode body, String table, String row) {
        var all = rows(body, table, row);
        return all.isEmpty() ? om.createObjectNode() : all.get(0);
    }

    private static void putIfPresent(Map<String, String> m, String key, JsonNode v) {
        if (!v.isMissingNode() && !v.isNull() && !v.asText().isBlank()) m.put(key, v.asText().trim());
    }

    /** aabb.ccdd.eeff -> aa:bb:cc:dd:ee:ff */
    static String normalizeMac(String raw) {
        var hex = raw.replaceAll("[^0-9A-Fa-f]", "").toLowerCase(Locale.ROOT);
        if (hex.length() != 12) return raw.toLowerCase(Locale.ROOT);
        var sb = new StringBuilder();
        for (int i = 0; i < 12; i += 2) {
            if (i > 0) sb.append(':');
            sb.append(hex, i, i + 2);
        }
        return sb.toString();
    }
}
