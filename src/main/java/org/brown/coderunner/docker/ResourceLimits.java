package org.brown.coderunner.docker;

import lombok.Value;

@Value
public class ResourceLimits {
    long memoryBytes;
    double cpuQuotaFraction;
    long pidsLimit;
}
