package com.cape.runtime.tool;

import java.util.Map;

/**
 * An external function TOOL capabilities call directly, without a sandbox.
 */
public interface CapabilityTool {

    String name();

    /**
     * @return structured result, becomes the capability output
     */
    Object call(Map<String, Object> arguments) throws Exception;
}
