package io.malicki.transferpipeline.processing;

@FunctionalInterface
public interface TransferJob {

    void run() throws Exception;
}
