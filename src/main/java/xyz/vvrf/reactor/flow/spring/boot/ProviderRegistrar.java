package xyz.vvrf.reactor.flow.spring.boot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ListableBeanFactory;
import xyz.vvrf.reactor.flow.annotation.FlowProvider;
import xyz.vvrf.reactor.flow.registry.ProviderRegistry;

import java.util.Map;

/**
 * 把 Spring 上下文中某一类 Provider Bean 注册到注册表。
 * 名称取自 {@link FlowProvider#value()}，未提供时回退为 Bean 名称。
 */
@Slf4j
final class ProviderRegistrar {

    private ProviderRegistrar() {
    }

    /**
     * @return 注册的 Provider 数量
     * @throws xyz.vvrf.reactor.flow.exception.FlowConfigurationException 如果 Provider 名称无效
     */
    static <F> int registerAll(ListableBeanFactory beanFactory, Class<F> providerType, ProviderRegistry<F> registry) {
        log.info("开始扫描 {} Bean...", providerType.getSimpleName());
        Map<String, F> beans = beanFactory.getBeansOfType(providerType);
        for (Map.Entry<String, F> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            String providerName = determineProviderName(beanFactory, beanName);
            log.debug("注册 {}: 名称='{}', Bean名='{}'", providerType.getSimpleName(), providerName, beanName);
            registry.register(providerName, entry.getValue());
        }
        log.info("[{}] 扫描完成。共注册了 {} 个 Provider，默认 Provider: {}",
                registry.getCategory(), beans.size(), registry.getDefaultProvider().orElse("<无>"));
        return beans.size();
    }

    private static String determineProviderName(ListableBeanFactory beanFactory, String beanName) {
        FlowProvider annotation = beanFactory.findAnnotationOnBean(beanName, FlowProvider.class);
        if (annotation == null || annotation.value().isEmpty()) {
            return beanName;
        }
        return annotation.value();
    }
}
