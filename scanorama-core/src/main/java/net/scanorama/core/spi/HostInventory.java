package net.scanorama.core.spi;

import net.scanorama.core.model.Host;
import net.scanorama.core.model.HostSelectionFilter;

import java.util.List;

public interface HostInventory {
    /** Hosts matching every predicate of the filter, most recently seen first. */
    List<Host> findHosts(HostSelectionFilter filter) throws Exception;
}
