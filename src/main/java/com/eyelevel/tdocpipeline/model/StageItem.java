package com.eyelevel.tdocpipeline.model;

/**
 * A unit of work handed to a stage. The key identifies the item in logs and failure reports.
 */
public interface StageItem {

    String itemKey();
}
