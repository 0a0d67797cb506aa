package io.surfworks.filebridge.license;

/**
 * Outcome of {@link MachineRegistry#registerMachine}.
 *
 * @param allowed whether the machine may use the license
 * @param machine the bound machine when allowed
 * @param activeMachines active bindings after the call
 * @param machineLimit the tier's cap
 * @param message hint shown on denial
 */
public record MachineRegistration(
    boolean allowed,
    Machine machine,
    int activeMachines,
    int machineLimit,
    String message
) {

    static MachineRegistration allowed(Machine machine, int activeMachines, int machineLimit) {
        return new MachineRegistration(true, machine, activeMachines, machineLimit, null);
    }

    static MachineRegistration limitExceeded(int activeMachines, int machineLimit) {
        return new MachineRegistration(false, null, activeMachines, machineLimit, String.format(
            "Machine limit reached (%d/%d). Deactivate one of your existing machines "
                + "before using this license here.", activeMachines, machineLimit));
    }
}
