package com.assettrack.inventory.model;

public enum AssignmentStatus { ACTIVE, RETURNED, OVERDUE, LOST }
