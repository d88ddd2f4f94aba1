package com.chaincustody.deposit.monitor;

import com.chaincustody.chain.AddressValidator;
import com.chaincustody.chain.ChainRegistry;
import com.chaincustody.config.MonitorProperties;
import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.ChainFamily;
import com.chaincustody.domain.WatchedAddress;
import com.chaincustody.domain.WatchedAddressRepository;
import com.chaincustody.node.NodeClientRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the deposit monitors: one per (chain, address). Registers new watched addresses (importing UTXO
 * addresses into the node's watch-only wallet first), starts monitors for stored addresses at startup and
 * restarts fail-stopped ones on request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositMonitorSupervisor {

    private final ChainRegistry chainRegistry;
    private final AddressValidator addressValidator;
    private final WatchedAddressRepository watchedAddressRepository;
    private final NodeClientRegistry nodeClients;
    private final DepositMonitorFactory monitorFactory;
    private final MonitorProperties monitorProperties;

    private final Map<String, DepositMonitor> monitors = new ConcurrentHashMap<>();

    /**
     * Persists the watched address (if new) and starts its monitor.
     *
     * @throws com.chaincustody.chain.UnsupportedChainException for unknown chains
     * @throws IllegalArgumentException when the address is not valid for the chain
     */
    public MonitorStatus register(String walletId, String chainId, String address) {
        ChainDescriptor chain = chainRegistry.resolve(chainId);
        if (!addressValidator.isValidAddress(chain, address)) {
            throw new IllegalArgumentException("Invalid " + chain.id() + " address: " + address);
        }
        WatchedAddress watched = watchedAddressRepository.findByChainAndAddress(chain.id(), address)
                .orElseGet(() -> save(WatchedAddress.of(walletId, chain.id(), address)));
        if (!watched.getWalletId().equals(walletId)) {
            throw new IllegalArgumentException("Address " + address + " is already watched for another wallet");
        }
        if (chain.family() == ChainFamily.UTXO) {
            nodeClients.forChain(chain.id()).importWatchAddress(address, walletId);
        }
        DepositMonitor monitor = monitors.computeIfAbsent(watched.monitorKey(), k -> monitorFactory.create(watched));
        monitor.start();
        return monitor.status();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (monitorProperties.isAutostart()) {
            startAll();
        }
    }

    /** Starts a monitor for every stored watched address on a registered chain. */
    public void startAll() {
        int started = 0;
        for (WatchedAddress watched : watchedAddressRepository.findAll()) {
            if (chainRegistry.find(watched.getChain()).isEmpty()) {
                log.warn("Skipping watched address {}: chain not configured", watched.monitorKey());
                continue;
            }
            ChainDescriptor chain = chainRegistry.resolve(watched.getChain());
            if (chain.family() == ChainFamily.UTXO) {
                try {
                    nodeClients.forChain(chain.id()).importWatchAddress(watched.getAddress(), watched.getWalletId());
                } catch (RuntimeException e) {
                    log.warn("Import of {} failed, monitor starts anyway: {}", watched.monitorKey(), e.getMessage());
                }
            }
            monitors.computeIfAbsent(watched.monitorKey(), k -> monitorFactory.create(watched)).start();
            started++;
        }
        log.info("Started {} deposit monitors", started);
    }

    public MonitorStatus restart(String chainId, String address) {
        DepositMonitor monitor = require(chainId, address);
        monitor.restart();
        return monitor.status();
    }

    public MonitorStatus stop(String chainId, String address) {
        DepositMonitor monitor = require(chainId, address);
        monitor.stop();
        return monitor.status();
    }

    public List<MonitorStatus> statuses() {
        return monitors.values().stream()
                .map(DepositMonitor::status)
                .sorted(Comparator.comparing(MonitorStatus::chain).thenComparing(MonitorStatus::address))
                .toList();
    }

    /**
     * Rescans the chain's watch-only wallet from the given height, picking up deposits made before an
     * address was imported.
     */
    public JsonNode rescan(String chainId, long fromHeight) {
        ChainDescriptor chain = chainRegistry.resolve(chainId);
        if (chain.family() != ChainFamily.UTXO) {
            throw new IllegalArgumentException("Rescan is only available for node-backed chains, not " + chain.id());
        }
        return nodeClients.forChain(chain.id()).rescanBlockchain(fromHeight);
    }

    @PreDestroy
    public void shutdown() {
        monitors.values().forEach(DepositMonitor::stop);
    }

    private WatchedAddress save(WatchedAddress watched) {
        try {
            return watchedAddressRepository.save(watched);
        } catch (DuplicateKeyException e) {
            return watchedAddressRepository.findByChainAndAddress(watched.getChain(), watched.getAddress())
                    .orElseThrow(() -> e);
        }
    }

    private DepositMonitor require(String chainId, String address) {
        String chain = chainRegistry.resolve(chainId).id();
        DepositMonitor monitor = monitors.get(chain + ":" + address);
        if (monitor == null) {
            throw new MonitorNotFoundException(chain, address);
        }
        return monitor;
    }
}
