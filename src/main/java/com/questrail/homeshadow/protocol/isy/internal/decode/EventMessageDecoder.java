package com.questrail.homeshadow.protocol.isy.internal.decode;

import com.questrail.homeshadow.api.EntityAddress;
import com.questrail.homeshadow.api.NodeChangeAction;
import com.questrail.homeshadow.api.PropertyValue;
import com.questrail.homeshadow.api.StatusChange;
import com.questrail.homeshadow.api.SystemStatus;
import com.questrail.homeshadow.api.UnitOfMeasure;
import com.questrail.homeshadow.protocol.isy.codec.EventDecodeException;
import com.questrail.homeshadow.protocol.isy.internal.events.StreamEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.StreamEvent.ProgramCondition;
import com.questrail.homeshadow.protocol.isy.internal.events.StreamEvent.ProgramRunState;
import com.questrail.homeshadow.protocol.isy.internal.frame.XmlElement;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * EventMessageDecoder
 * ============================================================================
 * Converts a parsed frame ({@link XmlElement}) into a semantic
 * {@link StreamEvent}.
 *
 * <h2>Routing</h2>
 * A {@code <SubscriptionResponse>} anywhere in the frame is a subscription
 * acknowledgement. Otherwise the root must be {@code <Event>}, routed by its
 * {@code <control>} code:
 *
 * <ul>
 *   <li>{@code _0} heartbeat; {@code action} is the advertised interval in
 *       seconds</li>
 *   <li>{@code ST} node status</li>
 *   <li>any code not starting with {@code _}: node control message</li>
 *   <li>{@code _1} action {@code 0}: program status; {@code 6}/{@code 7}:
 *       variable value / init value; other actions ignored</li>
 *   <li>{@code _3} node-list change; {@code _7} device programming
 *       progress</li>
 *   <li>{@code _5} system busy status</li>
 *   <li>every other {@code _n} category is ignored</li>
 * </ul>
 *
 * <h2>What this decoder does NOT do</h2>
 * It keeps no state and knows nothing about which entities exist.
 */
public final class EventMessageDecoder
{
    public static final String ROOT_EVENT = "Event";
    public static final String ROOT_SUBSCRIPTION = "SubscriptionResponse";

    private static final DateTimeFormatter PROGRAM_TIME = DateTimeFormatter.ofPattern("yyMMdd HH:mm:ss");

    private static final Pattern PROGRESS_MEMORY = Pattern.compile(
            ".*dbAddr=(?<dbAddr>[A-F0-9x]*) \\[(?<value>[A-F0-9]{2})\\] "
                    + "cmd1=(?<cmd1>[A-F0-9x]{4}) cmd2=(?<cmd2>[A-F0-9x]{4})");

    /**
     * @return the decoded event, or empty for a category that is ignored
     * @throws EventDecodeException if the frame cannot be mapped to an event
     */
    public Optional<StreamEvent> decode(XmlElement root) {
        Objects.requireNonNull(root, "root");

        Optional<XmlElement> subscription = root.find(ROOT_SUBSCRIPTION);
        if (subscription.isPresent()) {
            return Optional.of(decodeSubscription(subscription.get()));
        }

        if (!ROOT_EVENT.equals(root.name())) {
            throw new EventDecodeException("Unrecognized frame root <" + root.name() + ">");
        }

        String control = root.childText("control")
                .filter(c -> !c.isEmpty())
                .orElseThrow(() -> new EventDecodeException("Event frame without <control>"));

        return switch (control) {
            case "_0" -> Optional.of(decodeHeartbeat(root));
            case StatusChange.STATUS -> Optional.of(decodeStatus(root));
            case "_1" -> decodeTrigger(root);
            case "_3" -> decodeNodeChanged(root);
            case "_5" -> decodeSystemStatus(root);
            case "_7" -> Optional.of(decodeProgress(root));
            default -> control.startsWith("_")
                    ? Optional.empty()
                    : Optional.of(decodeControl(root, control));
        };
    }

    // ========================================================================
    // Session-level frames
    // ========================================================================

    private StreamEvent decodeSubscription(XmlElement response) {
        String sid = response.childText("SID").orElse("");
        return new StreamEvent.SubscriptionAck(sid);
    }

    private StreamEvent decodeHeartbeat(XmlElement event) {
        String action = event.childText("action").orElse("");
        long seconds;
        try {
            seconds = action.isEmpty() ? 0 : Long.parseLong(action);
        } catch (NumberFormatException e) {
            throw new EventDecodeException("Heartbeat interval is not a number: '" + action + "'", e);
        }
        if (seconds < 0) {
            throw new EventDecodeException("Negative heartbeat interval: " + seconds);
        }
        long sequence = event.attribute("seqnum").map(EventMessageDecoder::parseSequence).orElse(-1L);
        return new StreamEvent.Heartbeat(sequence, Duration.ofSeconds(seconds));
    }

    // ========================================================================
    // Node frames
    // ========================================================================

    private StreamEvent decodeStatus(XmlElement event) {
        EntityAddress address = EntityAddress.node(requireNode(event));
        XmlElement action = event.child("action")
                .orElseThrow(() -> new EventDecodeException("Status frame for " + address + " without <action>"));
        String formatted = event.childText("fmtAct").orElse("");
        return new StreamEvent.PropertyUpdate(address, StatusChange.STATUS, parseValue(action, formatted));
    }

    private StreamEvent decodeControl(XmlElement event, String control) {
        EntityAddress address = EntityAddress.node(requireNode(event));
        Optional<XmlElement> action = event.child("action");
        String formatted = event.childText("fmtAct").orElse("");

        Optional<PropertyValue> value = action
                .filter(a -> !a.text().isEmpty())
                .map(a -> parseValue(a, formatted));
        return new StreamEvent.ControlMessage(address, control, value);
    }

    private Optional<StreamEvent> decodeNodeChanged(XmlElement event) {
        String code = event.childText("action").orElse("");
        Optional<NodeChangeAction> action = NodeChangeAction.fromCode(code);
        if (action.isEmpty()) {
            return Optional.empty();
        }

        String node = requireNode(event);
        EntityAddress address = action.get().isGroupAction() ? EntityAddress.group(node) : EntityAddress.node(node);

        Map<String, String> info = new LinkedHashMap<>();
        event.child("eventInfo").ifPresent(ei -> {
            for (XmlElement c : ei.children()) {
                info.put(c.name(), c.text());
            }
        });
        return Optional.of(new StreamEvent.NodeListChanged(address, action.get(), info));
    }

    private StreamEvent decodeProgress(XmlElement event) {
        String text = event.childText("eventInfo").orElse("");
        int close = text.indexOf(']');
        if (!text.startsWith("[") || close < 0) {
            throw new EventDecodeException("Progress report without [address]: '" + text + "'");
        }
        String node = text.substring(1, close).trim();
        String message = text.substring(close + 1).trim();
        if (node.isEmpty()) {
            throw new EventDecodeException("Progress report with empty address");
        }

        NodeChangeAction action = NodeChangeAction.DEVICE_WRITING;
        Map<String, String> info = new LinkedHashMap<>();
        info.put("message", message);

        if (!"All".equals(node) && message.startsWith("Memory")) {
            action = NodeChangeAction.DEVICE_MEMORY;
            Matcher m = PROGRESS_MEMORY.matcher(message);
            if (m.find()) {
                info.clear();
                info.put("memory", m.group("dbAddr"));
                info.put("cmd1", m.group("cmd1"));
                info.put("cmd2", m.group("cmd2"));
                info.put("value", String.valueOf(Integer.parseInt(m.group("value"), 16)));
            }
        }
        return new StreamEvent.NodeListChanged(EntityAddress.node(node), action, info);
    }

    // ========================================================================
    // Programs and variables
    // ========================================================================

    private Optional<StreamEvent> decodeTrigger(XmlElement event) {
        String action = event.childText("action").orElse("");
        return switch (action) {
            case "0" -> Optional.of(decodeProgram(event));
            case "6" -> Optional.of(decodeVariable(event, false));
            case "7" -> Optional.of(decodeVariable(event, true));
            default -> Optional.empty();
        };
    }

    private StreamEvent decodeProgram(XmlElement event) {
        XmlElement info = event.child("eventInfo")
                .orElseThrow(() -> new EventDecodeException("Program frame without <eventInfo>"));
        String id = info.childText("id")
                .filter(s -> !s.isEmpty())
                .orElseThrow(() -> new EventDecodeException("Program frame without <id>"));

        Optional<Boolean> enabled = info.hasChild("on") ? Optional.of(true)
                : info.hasChild("off") ? Optional.of(false) : Optional.empty();
        Optional<Boolean> runAtStartup = info.hasChild("rr") ? Optional.of(true)
                : info.hasChild("nr") ? Optional.of(false) : Optional.empty();

        Optional<ProgramCondition> condition = Optional.empty();
        Optional<ProgramRunState> runState = Optional.empty();
        String status = info.childText("s").orElse("");
        if (!status.isEmpty()) {
            if (status.length() != 2) {
                throw new EventDecodeException("Program status must be two hex digits: '" + status + "'");
            }
            condition = ProgramCondition.fromCode(hexDigit(status.charAt(0)));
            runState = ProgramRunState.fromCode(hexDigit(status.charAt(1)));
        }

        return new StreamEvent.ProgramUpdate(
                EntityAddress.program(id),
                enabled,
                runAtStartup,
                condition,
                runState,
                info.childText("r").filter(s -> !s.isEmpty()).map(EventMessageDecoder::parseProgramTime),
                info.childText("f").filter(s -> !s.isEmpty()).map(EventMessageDecoder::parseProgramTime));
    }

    private StreamEvent decodeVariable(XmlElement event, boolean init) {
        XmlElement var = event.child("eventInfo")
                .flatMap(ei -> ei.child("var"))
                .orElseThrow(() -> new EventDecodeException("Variable frame without <var>"));

        int type = parseInt(var.attribute("type").orElse(""), "variable type");
        int id = parseInt(var.attribute("id").orElse(""), "variable id");
        String tag = init ? "init" : "val";
        String raw = var.childText(tag)
                .orElseThrow(() -> new EventDecodeException("Variable frame without <" + tag + ">"));
        int precision = var.childText("prec").map(EventMessageDecoder::parsePrecision).orElse(0);

        PropertyValue value = raw.isEmpty()
                ? PropertyValue.unknown()
                : PropertyValue.of(parseLong(raw, "variable value"), precision, UnitOfMeasure.NOT_SET, "");
        return new StreamEvent.PropertyUpdate(EntityAddress.variable(type, id),
                init ? "init" : StatusChange.STATUS, value);
    }

    private Optional<StreamEvent> decodeSystemStatus(XmlElement event) {
        return SystemStatus.fromCode(event.childText("action").orElse(""))
                .<StreamEvent>map(StreamEvent.SystemStatusChanged::new);
    }

    // ========================================================================
    // Field helpers
    // ========================================================================

    private static String requireNode(XmlElement event) {
        return event.childText("node")
                .filter(n -> !n.isEmpty())
                .orElseThrow(() -> new EventDecodeException("Event frame without <node>"));
    }

    /**
     * Reads {@code <action uom=".." prec="..">value</action>}. An absent
     * {@code uom} attribute is {@link UnitOfMeasure#NOT_SET}; an empty value is
     * unknown. Decimal text is carried as unscaled value plus precision.
     */
    static PropertyValue parseValue(XmlElement action, String formatted) {
        UnitOfMeasure unit = action.attribute("uom").map(UnitOfMeasure::of).orElse(UnitOfMeasure.NOT_SET);
        int precision = action.attribute("prec").map(EventMessageDecoder::parsePrecision).orElse(0);
        String text = action.text();

        if (text.isEmpty()) {
            return PropertyValue.unknown(unit, formatted);
        }
        if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
            try {
                BigDecimal decimal = new BigDecimal(text);
                if (decimal.scale() < 0) {
                    decimal = decimal.setScale(0);
                }
                return PropertyValue.of(decimal.unscaledValue().longValueExact(),
                        decimal.scale(), unit, formatted);
            } catch (NumberFormatException | ArithmeticException e) {
                throw new EventDecodeException("Property value is not a number: '" + text + "'", e);
            }
        }
        return PropertyValue.of(parseLong(text, "property value"), precision, unit, formatted);
    }

    private static int parsePrecision(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        int precision = parseInt(text, "precision");
        if (precision < 0) {
            throw new EventDecodeException("Negative precision: " + precision);
        }
        return precision;
    }

    private static long parseSequence(String text) {
        return parseLong(text, "seqnum");
    }

    private static LocalDateTime parseProgramTime(String text) {
        try {
            return LocalDateTime.parse(text, PROGRAM_TIME);
        } catch (DateTimeParseException e) {
            throw new EventDecodeException("Unparseable program time '" + text + "'", e);
        }
    }

    private static int hexDigit(char c) {
        int digit = Character.digit(c, 16);
        if (digit < 0) {
            throw new EventDecodeException("Not a hex digit: '" + c + "'");
        }
        return digit;
    }

    private static int parseInt(String text, String field) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new EventDecodeException("Invalid " + field + ": '" + text + "'", e);
        }
    }

    private static long parseLong(String text, String field) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new EventDecodeException("Invalid " + field + ": '" + text + "'", e);
        }
    }
}
