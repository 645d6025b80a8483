package xyz.vvrf.reactor.flow.annotation;

import org.springframework.stereotype.Component;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标记一个 {@link xyz.vvrf.reactor.flow.provider.LlmProvider}、
 * {@link xyz.vvrf.reactor.flow.provider.SearchProvider} 或
 * {@link xyz.vvrf.reactor.flow.provider.EmbeddingProvider} Bean 在注册表中使用的名称。
 * 没有该注解 (或 value 为空) 的 Provider Bean 以 Bean 名称注册。
 * <p>
 * 包含 {@link Component} 以便 Spring 在组件扫描期间自动检测这些类。
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
@Component
public @interface FlowProvider {

    /**
     * Provider 名称 (不能包含 "/" 或空白字符)。
     */
    String value() default "";
}
