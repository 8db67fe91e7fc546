package com.chatops.faq.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Getter
public class AerospikeConfig {

    // Review records, keyed by review id.
    public static final String SET_REVIEWS = "faq_reviews";
    // Single record holding the round-robin reviewer cursor.
    public static final String SET_REVIEWER_ROTATION = "reviewer_rotation";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:faqbot}")
    private String namespace;

    @Value("${aerospike.max-conns-per-node:100}")
    private int maxConnsPerNode;

    @Value("${aerospike.total-timeout-ms:3000}")
    private int totalTimeoutMs;

    @Value("${aerospike.socket-timeout-ms:1000}")
    private int socketTimeoutMs;

    // Reviews are listed by full scan; allow longer than point reads.
    @Value("${aerospike.scan-timeout-ms:10000}")
    private int scanTimeoutMs;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = maxConnsPerNode;
        clientPolicy.timeout = 5000;
        clientPolicy.readPolicyDefault = defaultReadPolicy();
        clientPolicy.writePolicyDefault = defaultWritePolicy();
        clientPolicy.scanPolicyDefault = reviewScanPolicy();

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = totalTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
        policy.sendKey = true;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = totalTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
        return policy;
    }

    @Bean
    public ScanPolicy reviewScanPolicy() {
        ScanPolicy policy = new ScanPolicy();
        policy.concurrentNodes = true;
        policy.totalTimeout = scanTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
