package xyz.vvrf.reactor.flow.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.exception.FlowConfigurationException;
import xyz.vvrf.reactor.flow.exception.ProviderLookupException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * ProviderRegistry 的内存实现。
 * 线程安全：注册和查找由读写锁保护，查找总能看到一致的 (Provider 表, 默认 Provider) 组合。
 *
 * @param <F> Provider 类型
 */
@Slf4j
public class SimpleProviderRegistry<F> implements ProviderRegistry<F> {

    private final String category;
    private final Map<String, F> providers = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private String defaultProvider;

    public SimpleProviderRegistry(String category) {
        this(category, null);
    }

    /**
     * @param category          类别名称 (不能为空)
     * @param configuredDefault 预先配置的默认 Provider 名称；为空时第一个注册的 Provider 成为默认值。
     *                          该名称在查找时才需要已注册。
     */
    public SimpleProviderRegistry(String category, String configuredDefault) {
        this.category = Objects.requireNonNull(category, "类别不能为空");
        if (configuredDefault != null && !configuredDefault.isEmpty()) {
            validateName(configuredDefault);
            this.defaultProvider = configuredDefault;
        }
        log.info("SimpleProviderRegistry 已创建，类别: {}, 配置的默认 Provider: {}", category, defaultProvider);
    }

    @Override
    public String getCategory() {
        return category;
    }

    @Override
    public void register(String name, F provider) {
        validateName(name);
        if (provider == null) {
            throw new FlowConfigurationException(String.format("[%s] Provider '%s' 的实现不能为空", category, name));
        }
        lock.writeLock().lock();
        try {
            F previous = providers.put(name, provider);
            if (previous != null) {
                log.warn("[{}] Provider '{}' 已存在，将被替换。 旧实现: {}, 新实现: {}",
                        category, name, previous.getClass().getName(), provider.getClass().getName());
            }
            if (defaultProvider == null) {
                defaultProvider = name;
                log.info("[{}] Provider '{}' 成为默认 Provider", category, name);
            }
            log.info("[{}] 已注册 Provider '{}' (实现: {})", category, name, provider.getClass().getName());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean unregister(String name) {
        if (name == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            boolean removed = providers.remove(name) != null;
            if (removed && name.equals(defaultProvider)) {
                defaultProvider = null;
                log.warn("[{}] 默认 Provider '{}' 已被移除，当前没有默认 Provider", category, name);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void setDefaultProvider(String name) {
        lock.writeLock().lock();
        try {
            if (name == null || !providers.containsKey(name)) {
                throw notRegistered(name);
            }
            defaultProvider = name;
            log.info("[{}] 默认 Provider 设置为 '{}'", category, name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<String> getDefaultProvider() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(defaultProvider);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> getProviderNames() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(providers.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean contains(String name) {
        lock.readLock().lock();
        try {
            return name != null && providers.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public F lookup(String name) {
        lock.readLock().lock();
        try {
            String effective = name != null ? name : defaultProvider;
            if (effective == null) {
                throw noDefault();
            }
            F provider = providers.get(effective);
            if (provider == null) {
                throw notRegistered(effective);
            }
            return provider;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ResolvedProvider<F> resolve(String specifier) {
        String providerName = null;
        String modelName = specifier;
        if (specifier != null) {
            int idx = specifier.indexOf(SEPARATOR);
            if (idx >= 0) {
                providerName = specifier.substring(0, idx);
                modelName = specifier.substring(idx + SEPARATOR.length());
            }
        }
        lock.readLock().lock();
        try {
            String effective = providerName != null ? providerName : defaultProvider;
            if (effective == null) {
                throw noDefault();
            }
            F provider = providers.get(effective);
            if (provider == null) {
                throw notRegistered(effective);
            }
            log.debug("[{}] 说明符 '{}' 解析为 Provider '{}', 模型 '{}'", category, specifier, effective, modelName);
            return new ResolvedProvider<>(effective, modelName, provider);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new FlowConfigurationException(String.format("[%s] Provider 名称不能为空", category));
        }
        if (name.contains(SEPARATOR)) {
            throw new FlowConfigurationException(String.format("[%s] Provider 名称 '%s' 不能包含 '%s'", category, name, SEPARATOR));
        }
        for (int i = 0; i < name.length(); i++) {
            if (Character.isWhitespace(name.charAt(i))) {
                throw new FlowConfigurationException(String.format("[%s] Provider 名称 '%s' 不能包含空白字符", category, name));
            }
        }
    }

    // 调用方需持有锁
    private ProviderLookupException notRegistered(String name) {
        List<String> available = new ArrayList<>(providers.keySet());
        return new ProviderLookupException(
                String.format("[%s] Provider '%s' 未注册。 可用的 Provider: %s", category, name, available),
                name, available);
    }

    private ProviderLookupException noDefault() {
        List<String> available = new ArrayList<>(providers.keySet());
        String message = available.isEmpty()
                ? String.format("[%s] 尚未注册任何 Provider", category)
                : String.format("[%s] 未指定 Provider 且没有默认 Provider。 可用的 Provider: %s", category, available);
        return new ProviderLookupException(message, null, available);
    }
}
