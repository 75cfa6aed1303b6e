package org.carma.coalition.mechanism;

import org.carma.coalition.model.*;

import java.util.*;

/**
 * One VM placement problem: the pooled PMs and VMs of a coalition plus the
 * scenario's specifications and cost tables.
 *
 * PMs and VMs are listed provider-major: all machines of the lowest-indexed
 * member first, and within a provider by type index. A provider's PMs take
 * their initial power states from the provider's list in the same order.
 */
public final class AllocationProblem {

    private final Scenario scenario;
    private final List<PhysicalMachine> pms;
    private final List<VirtualMachine> vms;
    private final AllocationObjective objective;

    public AllocationProblem(Scenario scenario, List<PhysicalMachine> pms, List<VirtualMachine> vms,
                             AllocationObjective objective) {
        this.scenario = Objects.requireNonNull(scenario, "Scenario cannot be null");
        this.pms = List.copyOf(pms);
        this.vms = List.copyOf(vms);
        this.objective = Objects.requireNonNull(objective, "Objective cannot be null");
    }

    /**
     * Pool the machines of every member of a coalition.
     */
    public static AllocationProblem forCoalition(Scenario scenario, CoalitionId coalition,
                                                 AllocationObjective objective) {
        List<PhysicalMachine> pms = new ArrayList<>();
        List<VirtualMachine> vms = new ArrayList<>();

        for (int cip : coalition.members()) {
            int k = 0;
            for (int p = 0; p < scenario.getNumPmTypes(); p++) {
                for (int i = 0; i < scenario.getPmCount(cip, p); i++) {
                    pms.add(new PhysicalMachine(cip, p, scenario.isPmPoweredOn(cip, k)));
                    k++;
                }
            }
            for (int v = 0; v < scenario.getNumVmTypes(); v++) {
                for (int i = 0; i < scenario.getVmCount(cip, v); i++) {
                    vms.add(new VirtualMachine(cip, v));
                }
            }
        }
        return new AllocationProblem(scenario, pms, vms, objective);
    }

    public Scenario getScenario() { return scenario; }
    public List<PhysicalMachine> getPms() { return pms; }
    public List<VirtualMachine> getVms() { return vms; }
    public AllocationObjective getObjective() { return objective; }

    public int getNumPms() { return pms.size(); }
    public int getNumVms() { return vms.size(); }

    public boolean isEmpty() {
        return pms.isEmpty() && vms.isEmpty();
    }

    /**
     * Revenue of hosting every VM of the problem, credited to each VM's origin.
     */
    public double getRevenue() {
        double revenue = 0;
        for (VirtualMachine vm : vms) {
            revenue += scenario.getRevenue(vm.provider(), vm.category());
        }
        return revenue;
    }

    public double getCpuShare(int vm, int pm) {
        return scenario.getVmCpuShare(vms.get(vm).category(), pms.get(pm).category());
    }

    public double getRamShare(int vm, int pm) {
        return scenario.getVmRamShare(vms.get(vm).category(), pms.get(pm).category());
    }

    /**
     * Watts drawn by a powered-on PM at the given CPU utilization.
     */
    public double consumedPower(int pm, double cpuShare) {
        int type = pms.get(pm).category();
        double min = scenario.getPmMinPower(type);
        double max = scenario.getPmMaxPower(type);
        return min + (max - min) * cpuShare;
    }

    /**
     * Electricity cost in $ per Wh for the owner of a PM.
     */
    public double getWattHourCost(int pm) {
        return scenario.getElectricityCost(pms.get(pm).provider()) * 1e-3;
    }

    @Override
    public String toString() {
        return String.format("AllocationProblem[pms=%d, vms=%d, objective=%s]", pms.size(), vms.size(), objective);
    }
}
