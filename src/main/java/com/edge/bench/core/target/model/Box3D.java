package com.edge.bench.core.target.model;

/**
 * 三维框几何信息
 * <p>
 * 对基准引擎而言是不透明的，只由外部 IoU 计算使用
 */
public class Box3D {
    private double x;
    private double y;
    private double z;
    private double length;
    private double width;
    private double height;
    private double yaw;             // 绕 z 轴的朝向角（弧度）

    public Box3D() {
    }

    public Box3D(double x, double y, double z, double length, double width, double height, double yaw) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.length = length;
        this.width = width;
        this.height = height;
        this.yaw = yaw;
    }

    // Getters and Setters
    public double getX() { return x; }
    public void setX(double x) { this.x = x; }

    public double getY() { return y; }
    public void setY(double y) { this.y = y; }

    public double getZ() { return z; }
    public void setZ(double z) { this.z = z; }

    public double getLength() { return length; }
    public void setLength(double length) { this.length = length; }

    public double getWidth() { return width; }
    public void setWidth(double width) { this.width = width; }

    public double getHeight() { return height; }
    public void setHeight(double height) { this.height = height; }

    public double getYaw() { return yaw; }
    public void setYaw(double yaw) { this.yaw = yaw; }

    @Override
    public String toString() {
        return String.format("Box3D[center=(%.2f,%.2f,%.2f), size=%.2fx%.2fx%.2f, yaw=%.2f]",
            x, y, z, length, width, height, yaw);
    }
}
