package com.eainde.fitengine.model;

public enum JobFunction {
    PRODUCT_MANAGEMENT("Product Management"),
    PROGRAM_MANAGEMENT("Program Management"),
    PROJECT_MANAGEMENT("Project Management"),
    ENGINEERING("Engineering"),
    ENGINEERING_MANAGEMENT("Engineering Management"),
    DATA_ANALYTICS("Data Analytics"),
    STRATEGY_OPERATIONS("Strategy & Operations"),
    OPERATIONS("Operations"),
    MARKETING("Marketing"),
    SALES("Sales"),
    RECRUITING("Recruiting"),
    DESIGN("Design"),
    FINANCE("Finance"),
    CUSTOMER_SUCCESS("Customer Success"),
    HUMAN_RESOURCES("Human Resources"),
    OTHER("Other");

    private final String label;

    JobFunction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
