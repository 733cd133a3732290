package org.tenantwarehouse.models.pipeline;

public record Schedule(String expression) {

    public static Schedule cron(String expression) {
        return new Schedule(expression);
    }
}
