package org.carma.coalition.model;

/**
 * Share of a coalition's allocation that runs on one provider's machines.
 *
 * @param numPoweredOnPms  PMs of the provider left on
 * @param numHostedVms     VMs (from any coalition member) placed on them
 * @param watts            power drawn by those PMs
 */
public record ProviderAllocationInfo(int numPoweredOnPms, int numHostedVms, double watts) {

    public static final ProviderAllocationInfo NONE = new ProviderAllocationInfo(0, 0, 0.0);
}
