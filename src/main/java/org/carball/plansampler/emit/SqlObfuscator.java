package org.carball.plansampler.emit;

/**
 * Removes literal values from statements and plans before they leave the collector.
 */
public interface SqlObfuscator {

    String obfuscateSql(String sql);

    /**
     * @param normalize also drop values that change between executions of the same plan
     */
    String obfuscatePlan(String plan, boolean normalize);
}
