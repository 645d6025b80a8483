package xyz.vvrf.reactor.flow.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 贯穿一次完整运行的可变键值上下文，是节点之间交换数据的唯一通道。
 * <p>
 * 引擎不对其施加任何 schema。只应在 prep/post 阶段读写，exec 阶段无法访问。
 * 底层使用并发 Map，因此并发分支写入不同的键是安全的；
 * 对同一个键的并发写入不做任何串行化，隔离由调用方负责。
 * 值不能为 null：写入 null 等价于删除该键。
 */
public final class SharedStore {

    private final Map<String, Object> data = new ConcurrentHashMap<>();

    public SharedStore() {
    }

    /**
     * 以初始数据创建 (null 值会被忽略)。
     */
    public SharedStore(Map<String, ?> initial) {
        if (initial != null) {
            initial.forEach(this::put);
        }
    }

    public static SharedStore of(Map<String, ?> initial) {
        return new SharedStore(initial);
    }

    public Object get(String key) {
        return data.get(Objects.requireNonNull(key, "键不能为空"));
    }

    /**
     * 按类型读取。
     *
     * @throws IllegalStateException 如果值存在但类型不匹配
     */
    public <T> T get(String key, Class<T> type) {
        Object value = get(key);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException(String.format("SharedStore 键 '%s' 的值类型为 %s，期望 %s",
                    key, value.getClass().getName(), type.getName()));
        }
        return type.cast(value);
    }

    public <T> Optional<T> find(String key, Class<T> type) {
        return Optional.ofNullable(get(key, type));
    }

    public Object getOrDefault(String key, Object defaultValue) {
        Object value = get(key);
        return value != null ? value : defaultValue;
    }

    public <T> T getOrDefault(String key, Class<T> type, T defaultValue) {
        T value = get(key, type);
        return value != null ? value : defaultValue;
    }

    /**
     * 写入一个值；value 为 null 时删除该键。
     *
     * @return 之前的值
     */
    public Object put(String key, Object value) {
        Objects.requireNonNull(key, "键不能为空");
        if (value == null) {
            return data.remove(key);
        }
        return data.put(key, value);
    }

    public Object putIfAbsent(String key, Object value) {
        return data.putIfAbsent(Objects.requireNonNull(key, "键不能为空"),
                Objects.requireNonNull(value, "值不能为空"));
    }

    public Object remove(String key) {
        return data.remove(Objects.requireNonNull(key, "键不能为空"));
    }

    public boolean containsKey(String key) {
        return data.containsKey(Objects.requireNonNull(key, "键不能为空"));
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(data.keySet());
    }

    public int size() {
        return data.size();
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    /**
     * @return 当前内容的不可变快照
     */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    @Override
    public String toString() {
        return "SharedStore" + data;
    }
}
