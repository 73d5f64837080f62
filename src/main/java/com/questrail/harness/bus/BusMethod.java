package com.questrail.harness.bus;

import java.util.List;

/**
 * Implementation of a remotely callable method exported on the bus.
 */
@FunctionalInterface
public interface BusMethod
{
    Object invoke(List<Object> args) throws Exception;
}
