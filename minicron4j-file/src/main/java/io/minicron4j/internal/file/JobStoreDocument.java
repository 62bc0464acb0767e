package io.minicron4j.internal.file;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the jobs file: {@code { "jobs": [...], "version": 1 }}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"jobs", "version"})
public class JobStoreDocument {

    private List<JobDocument> jobs = new ArrayList<>();
    private int version;

    public JobStoreDocument() {
    }

    public JobStoreDocument(List<JobDocument> jobs, int version) {
        this.jobs = jobs;
        this.version = version;
    }

    public List<JobDocument> getJobs() {
        return jobs;
    }

    public void setJobs(List<JobDocument> jobs) {
        this.jobs = jobs;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }
}
