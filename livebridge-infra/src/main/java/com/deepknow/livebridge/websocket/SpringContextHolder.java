package com.deepknow.livebridge.websocket;

import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.stereotype.Component;

/**
 * 端点实例由 WebSocket 容器创建，注入器尚未执行时从这里兜底取 Bean。
 */
@Component
public class SpringContextHolder implements ApplicationContextAware {
    private static volatile ApplicationContext ctx;

    @Override
    public void setApplicationContext(ApplicationContext applicationContext) {
        SpringContextHolder.ctx = applicationContext;
    }

    public static <T> T getBean(Class<T> clazz) {
        ApplicationContext c = ctx;
        if (c == null) {
            return null;
        }
        return c.getBeanProvider(clazz).getIfAvailable();
    }
}
