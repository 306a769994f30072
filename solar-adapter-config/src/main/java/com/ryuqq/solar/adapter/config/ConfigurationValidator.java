package com.ryuqq.solar.adapter.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.solar.core.config.ConfigurationException;
import com.ryuqq.solar.core.config.ControlSettings;
import com.ryuqq.solar.core.model.Position;
import com.ryuqq.solar.core.model.RunnerKey;
import com.ryuqq.solar.core.runner.RunnerSettings;
import com.ryuqq.solar.core.safety.SafetyPolicy;
import com.ryuqq.solar.core.schedule.DailySchedule;
import com.ryuqq.solar.core.schedule.DockPolicy;
import com.ryuqq.solar.core.schedule.ScheduleTask;
import com.ryuqq.solar.core.schedule.TaskCategory;
import com.ryuqq.solar.core.schedule.TimeTrigger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * YAML 트리를 설정 레코드로 변환하며 모든 문제를 수집합니다.
 *
 * <p>첫 오류에서 멈추지 않고 네 문서 전체를 검사하여 {@link ValidationError} 목록을 만듭니다.
 * 오류가 없을 때만 {@link SolarConfiguration}이 만들어집니다.</p>
 *
 * <p><strong>검사 항목:</strong></p>
 * <ul>
 *   <li>application: 간격/시간은 양수 초 단위 숫자, battery_safety 범위, dock</li>
 *   <li>runners: 키 형식, type 필수 및 등록 여부, enabled 불리언, measurement_interval 양수,
 *       error_ceiling 양의 정수, {@code i2c_address} 16진수 문자열, {@code *_pin} GPIO 번호(0~27)</li>
 *   <li>tasks: time 또는 time_range 중 정확히 하나, type은 navigation/system_check, actions 문자열 목록</li>
 *   <li>locations: 이름마다 숫자 x, y</li>
 * </ul>
 *
 * <p>스케줄 대상이 locations에 없으면 경고만 남깁니다 (실행 중 Dock으로 오버라이드됨).</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class ConfigurationValidator {

    /**
     * Runner 공통 필드 (나머지는 타입별 속성으로 전달).
     */
    static final Set<String> RESERVED_RUNNER_FIELDS =
        Set.of("type", "label", "enabled", "measurement_interval", "error_ceiling");

    private static final Pattern HEX_ADDRESS = Pattern.compile("0[xX][0-9a-fA-F]{1,2}");
    private static final int MAX_GPIO_PIN = 27;

    private final Predicate<String> knownRunnerType;

    /**
     * 생성자.
     *
     * @param knownRunnerType 등록된 Runner 타입 판별 (별칭 포함)
     */
    public ConfigurationValidator(Predicate<String> knownRunnerType) {
        if (knownRunnerType == null) {
            throw new IllegalArgumentException("knownRunnerType cannot be null");
        }
        this.knownRunnerType = knownRunnerType;
    }

    /**
     * 네 문서를 검증하고 변환.
     *
     * @param solar solar.yaml 루트 (null이면 없는 것으로 처리)
     * @param runners runners.yaml 루트
     * @param schedule daily_schedule.yaml 루트
     * @param locations locations.yaml 루트 (선택)
     * @return 검증 결과
     */
    public ValidationResult validate(JsonNode solar, JsonNode runners, JsonNode schedule, JsonNode locations) {
        Problems problems = new Problems();

        JsonNode application = section(solar, "application", problems);
        ControlSettings control = controlSettings(application, problems);
        SafetyPolicy safety = safetyPolicy(application == null ? null : application.get("battery_safety"), problems);
        DockPolicy dock = dockPolicy(application == null ? null : application.get("dock"), problems);

        if (control != null && safety != null && safety.staleAfter().compareTo(control.updateInterval()) < 0) {
            problems.warn("application.battery_safety.stale_after",
                "shorter than update_interval, every sample will be considered stale");
        }

        List<RunnerSettings> runnerList = runners(section(runners, "runners", problems), problems);
        Map<String, Position> locationMap = locations(locations, problems);
        DailySchedule dailySchedule = schedule(schedule, dock, locationMap, problems);

        if (!problems.errors.isEmpty()) {
            return new ValidationResult(null, problems.errors, problems.warnings);
        }
        SolarConfiguration configuration =
            new SolarConfiguration(control, safety, dock, runnerList, dailySchedule, locationMap);
        return new ValidationResult(configuration, problems.errors, problems.warnings);
    }

    /**
     * runners.yaml만 검증 (실행 중 재설정용).
     *
     * @param runners runners.yaml 루트
     * @return 오류가 없으면 설정 목록
     * @throws ConfigurationException 오류가 있는 경우
     */
    public List<RunnerSettings> validateRunners(JsonNode runners) {
        Problems problems = new Problems();
        List<RunnerSettings> result = runners(section(runners, "runners", problems), problems);
        problems.throwIfErrors("Invalid runner configuration");
        return result;
    }

    // ========== application ==========

    private ControlSettings controlSettings(JsonNode application, Problems problems) {
        ControlSettings defaults = new ControlSettings();
        String base = "application.";
        Duration mainLoop = seconds(application, "main_loop_interval", base, defaults.mainLoopInterval(), false, problems);
        Duration shutdown = seconds(application, "shutdown_timeout", base, defaults.shutdownTimeout(), true, problems);
        Duration startup = seconds(application, "startup_timeout", base, defaults.startupTimeout(), true, problems);
        JsonNode safety = application == null ? null : application.get("battery_safety");
        Duration update = seconds(safety, "update_interval", base + "battery_safety.",
            defaults.updateInterval(), false, problems);
        if (mainLoop == null || shutdown == null || startup == null || update == null) {
            return null;
        }
        return new ControlSettings(mainLoop, update, shutdown, startup);
    }

    private SafetyPolicy safetyPolicy(JsonNode node, Problems problems) {
        SafetyPolicy defaults = new SafetyPolicy();
        String base = "application.battery_safety.";
        if (node != null && !node.isNull() && !node.isObject()) {
            problems.error("application.battery_safety", "must be a mapping");
            return null;
        }
        Double threshold = number(node, "min_battery_threshold", base, defaults.minBatteryThreshold(), problems);
        Double factor = number(node, "max_distance_factor", base, defaults.maxDistanceFactor(), problems);
        Double range = number(node, "total_range", base, defaults.totalRange(), problems);
        Duration staleAfter = seconds(node, "stale_after", base, defaults.staleAfter(), false, problems);

        boolean valid = staleAfter != null;
        if (threshold != null && (threshold < 0.0 || threshold > 100.0)) {
            problems.error(base + "min_battery_threshold", "must be between 0 and 100 (got: " + threshold + ")");
            valid = false;
        }
        if (factor != null && factor <= 0.0) {
            problems.error(base + "max_distance_factor", "must be positive (got: " + factor + ")");
            valid = false;
        }
        if (range != null && range <= 0.0) {
            problems.error(base + "total_range", "must be positive (got: " + range + ")");
            valid = false;
        }
        if (!valid || threshold == null || factor == null || range == null) {
            return null;
        }
        return new SafetyPolicy(threshold, factor, range, staleAfter);
    }

    private DockPolicy dockPolicy(JsonNode node, Problems problems) {
        if (node == null || node.isNull()) {
            return new DockPolicy();
        }
        if (!node.isObject()) {
            problems.error("application.dock", "must be a mapping with target and actions");
            return new DockPolicy();
        }
        String target = text(node, "target", "application.dock.", DockPolicy.DEFAULT_TARGET, problems);
        List<String> actions = stringList(node.get("actions"), "application.dock.actions", problems);
        if (actions == null || actions.isEmpty()) {
            actions = List.of("charge");
        }
        if (target == null || target.isBlank()) {
            problems.error("application.dock.target", "cannot be blank");
            return new DockPolicy();
        }
        return new DockPolicy(target, actions);
    }

    // ========== runners ==========

    private List<RunnerSettings> runners(JsonNode node, Problems problems) {
        List<RunnerSettings> result = new ArrayList<>();
        if (node == null) {
            return result;
        }
        if (!node.isObject()) {
            problems.error("runners", "must be a mapping of runner key to settings");
            return result;
        }
        if (node.isEmpty()) {
            problems.warn("runners", "no runners configured");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            RunnerSettings settings = runner(entry.getKey(), entry.getValue(), problems);
            if (settings != null) {
                result.add(settings);
            }
        }
        return result;
    }

    private RunnerSettings runner(String name, JsonNode node, Problems problems) {
        String base = "runners." + name + ".";
        RunnerKey key;
        try {
            key = RunnerKey.of(name);
        } catch (IllegalArgumentException e) {
            problems.error("runners." + name, e.getMessage());
            return null;
        }
        if (node == null || !node.isObject()) {
            problems.error("runners." + name, "must be a mapping");
            return null;
        }
        int before = problems.errors.size();

        String type = text(node, "type", base, null, problems);
        if (type == null || type.isBlank()) {
            problems.error(base + "type", "missing required field");
        } else if (!knownRunnerType.test(type)) {
            problems.error(base + "type", "unknown runner type '" + type + "'");
        }
        String label = text(node, "label", base, null, problems);
        boolean enabled = true;
        JsonNode enabledNode = node.get("enabled");
        if (enabledNode != null && !enabledNode.isNull()) {
            if (enabledNode.isBoolean()) {
                enabled = enabledNode.booleanValue();
            } else {
                problems.error(base + "enabled", "must be a boolean (got: " + enabledNode.asText() + ")");
            }
        }
        Duration interval = seconds(node, "measurement_interval", base, RunnerSettings.DEFAULT_INTERVAL, false, problems);
        int errorCeiling = RunnerSettings.DEFAULT_ERROR_CEILING;
        JsonNode ceilingNode = node.get("error_ceiling");
        if (ceilingNode != null && !ceilingNode.isNull()) {
            if (!ceilingNode.canConvertToInt() || !ceilingNode.isIntegralNumber() || ceilingNode.intValue() <= 0) {
                problems.error(base + "error_ceiling", "must be a positive integer (got: " + ceilingNode.asText() + ")");
            } else {
                errorCeiling = ceilingNode.intValue();
            }
        }

        Map<String, Object> properties = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String fieldName = field.getKey();
            JsonNode value = field.getValue();
            if (RESERVED_RUNNER_FIELDS.contains(fieldName) || value == null || value.isNull()) {
                continue;
            }
            checkHardwareField(base + fieldName, fieldName, value, problems);
            properties.put(fieldName, Yamls.mapper().convertValue(value, Object.class));
        }

        if (problems.errors.size() > before) {
            return null;
        }
        return new RunnerSettings(key, type.trim(), enabled, label, interval, errorCeiling, properties);
    }

    private static void checkHardwareField(String path, String fieldName, JsonNode value, Problems problems) {
        if (fieldName.equals("i2c_address")) {
            if (!value.isTextual() || !HEX_ADDRESS.matcher(value.textValue().trim()).matches()) {
                problems.error(path, "must be a hex string such as '0x40' (got: " + value.asText() + ")");
            }
        } else if (fieldName.endsWith("_pin")) {
            if (!value.isIntegralNumber() || value.intValue() < 0 || value.intValue() > MAX_GPIO_PIN) {
                problems.error(path, "must be a GPIO pin number between 0 and " + MAX_GPIO_PIN
                    + " (got: " + value.asText() + ")");
            }
        }
    }

    // ========== schedule ==========

    private DailySchedule schedule(
        JsonNode root, DockPolicy dock, Map<String, Position> locations, Problems problems
    ) {
        JsonNode tasks = section(root, "tasks", problems);
        if (tasks == null) {
            return DailySchedule.empty();
        }
        if (!tasks.isArray()) {
            problems.error("tasks", "must be a list");
            return DailySchedule.empty();
        }
        List<ScheduleTask> result = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i++) {
            ScheduleTask task = task("tasks[" + i + "]", tasks.get(i), problems);
            if (task == null) {
                continue;
            }
            result.add(task);
            String target = task.target();
            if (target != null && !dock.isDock(target) && !locations.containsKey(target)) {
                problems.warn("tasks[" + i + "].target",
                    "unknown location '" + target + "', the task will be overridden to " + dock.target());
            }
        }
        return new DailySchedule(result);
    }

    private ScheduleTask task(String path, JsonNode node, Problems problems) {
        if (node == null || !node.isObject()) {
            problems.error(path, "must be a mapping");
            return null;
        }
        int before = problems.errors.size();
        JsonNode time = node.get("time");
        JsonNode range = node.get("time_range");
        TimeTrigger trigger = null;
        if ((time == null) == (range == null)) {
            problems.error(path, "exactly one of 'time' or 'time_range' is required");
        } else {
            try {
                trigger = time != null
                    ? ScheduleEntryParser.parseTime(time.asText())
                    : ScheduleEntryParser.parseRange(range.asText());
            } catch (IllegalArgumentException e) {
                problems.error(path + (time != null ? ".time" : ".time_range"), e.getMessage());
            }
        }

        TaskCategory category = null;
        String tag = text(node, "type", path + ".", null, problems);
        if (tag == null) {
            problems.error(path + ".type", "missing required field");
        } else {
            try {
                category = TaskCategory.fromTag(tag);
            } catch (IllegalArgumentException e) {
                problems.error(path + ".type", e.getMessage());
            }
        }
        String target = text(node, "target", path + ".", null, problems);
        List<String> actions = stringList(node.get("actions"), path + ".actions", problems);
        if (actions == null) {
            problems.error(path + ".actions", "missing required field");
        } else if (actions.isEmpty()) {
            problems.warn(path + ".actions", "no actions listed");
        }

        if (problems.errors.size() > before) {
            return null;
        }
        try {
            return new ScheduleTask(trigger, category, target, actions);
        } catch (IllegalArgumentException e) {
            problems.error(path, e.getMessage());
            return null;
        }
    }

    // ========== locations ==========

    private Map<String, Position> locations(JsonNode root, Problems problems) {
        Map<String, Position> result = new LinkedHashMap<>();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return result;
        }
        if (!root.isObject()) {
            problems.error("locations", "must be a mapping of name to {x, y}");
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String base = "locations." + entry.getKey();
            JsonNode node = entry.getValue();
            if (node == null || !node.isObject()) {
                problems.error(base, "must be a mapping with x and y");
                continue;
            }
            JsonNode x = node.get("x");
            JsonNode y = node.get("y");
            if (x == null || !x.isNumber() || y == null || !y.isNumber()) {
                problems.error(base, "x and y must be numbers");
                continue;
            }
            try {
                result.put(entry.getKey(), new Position(x.doubleValue(), y.doubleValue()));
            } catch (IllegalArgumentException e) {
                problems.error(base, e.getMessage());
            }
        }
        return result;
    }

    // ========== 공통 ==========

    private static JsonNode section(JsonNode root, String name, Problems problems) {
        JsonNode node = root == null ? null : root.get(name);
        if (node == null || node.isNull()) {
            problems.error(name, "missing required section");
            return null;
        }
        return node;
    }

    private static Duration seconds(
        JsonNode parent, String field, String base, Duration defaultValue, boolean allowZero, Problems problems
    ) {
        JsonNode node = parent == null ? null : parent.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isNumber()) {
            problems.error(base + field, "must be a number of seconds (got: " + node.asText() + ")");
            return null;
        }
        double value = node.doubleValue();
        if (value < 0.0 || (!allowZero && value == 0.0) || Double.isNaN(value) || Double.isInfinite(value)) {
            problems.error(base + field, (allowZero ? "cannot be negative" : "must be positive") + " (got: " + value + ")");
            return null;
        }
        Duration duration = Duration.ofNanos(Math.round(value * 1_000_000_000d));
        if (!allowZero && duration.isZero()) {
            problems.error(base + field, "must be positive (got: " + value + ")");
            return null;
        }
        return duration;
    }

    private static Double number(JsonNode parent, String field, String base, double defaultValue, Problems problems) {
        JsonNode node = parent == null ? null : parent.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isNumber()) {
            problems.error(base + field, "must be a number (got: " + node.asText() + ")");
            return null;
        }
        return node.doubleValue();
    }

    private static String text(JsonNode parent, String field, String base, String defaultValue, Problems problems) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isValueNode() || node.isBoolean()) {
            problems.error(base + field, "must be a string");
            return defaultValue;
        }
        return node.asText();
    }

    private static List<String> stringList(JsonNode node, String path, Problems problems) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            problems.error(path, "must be a list of strings");
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual() || item.textValue().isBlank()) {
                problems.error(path, "entries must be non-blank strings (got: " + item + ")");
                continue;
            }
            values.add(item.textValue().trim());
        }
        return values;
    }

    private static final class Problems {

        private final List<ValidationError> errors = new ArrayList<>();
        private final List<ValidationError> warnings = new ArrayList<>();

        void error(String path, String message) {
            errors.add(new ValidationError(path, message));
        }

        void warn(String path, String message) {
            warnings.add(new ValidationError(path, message));
        }

        void throwIfErrors(String summary) {
            if (!errors.isEmpty()) {
                throw new ConfigurationException(summary, errors.stream().map(ValidationError::toString).toList());
            }
        }
    }
}
