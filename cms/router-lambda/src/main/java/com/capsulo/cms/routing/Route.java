package com.capsulo.cms.routing;

@FunctionalInterface
public interface Route {
    Object handle(CmsRequest req) throws Exception;
}
