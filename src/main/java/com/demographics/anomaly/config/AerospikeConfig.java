package com.demographics.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Getter
public class AerospikeConfig {

    public static final String SET_OBSERVATIONS = "observations";
    public static final String SET_ANOMALY_RECORDS = "anomaly_records";
    public static final String SET_MV_OUTLIERS = "mv_outliers";
    public static final String SET_DISCREPANCIES = "discrepancies";
    public static final String SET_CONFIRMATIONS = "confirmations";
    public static final String SET_PROVIDER_ENTITY_CRED = "prov_entity_cred";
    public static final String SET_PROVIDER_CRED = "provider_cred";
    public static final String SET_ANALYSIS_RUNS = "analysis_runs";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:demographics}")
    private String namespace;

    @Bean
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;

        // Batch scans over observation sets run longer than point reads
        clientPolicy.readPolicyDefault.totalTimeout = 10000;
        clientPolicy.readPolicyDefault.socketTimeout = 3000;

        clientPolicy.writePolicyDefault.totalTimeout = 3000;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        // Keys are stored so scans can return them for rollback and upsert
        policy.sendKey = true;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
